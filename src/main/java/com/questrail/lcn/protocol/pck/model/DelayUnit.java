package com.questrail.lcn.protocol.pck.model;

/**
 * Time units used by deferred key and temporary lock commands.
 */
public enum DelayUnit {
    SECONDS('S', 60),
    MINUTES('M', 90),
    HOURS('H', 50),
    DAYS('D', 45);

    private final char code;
    private final int maxValue;

    DelayUnit(char code, int maxValue) {
        this.code = code;
        this.maxValue = maxValue;
    }

    public char code() {
        return code;
    }

    /** Largest count accepted for this unit (the smallest is 1). */
    public int maxValue() {
        return maxValue;
    }
}
