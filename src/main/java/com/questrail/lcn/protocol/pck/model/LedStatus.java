package com.questrail.lcn.protocol.pck.model;

/**
 * LED states as transmitted in {@code LA} commands and {@code TL} reports.
 */
public enum LedStatus {
    OFF('A'),
    ON('E'),
    BLINK('B'),
    FLICKER('F');

    private final char code;

    LedStatus(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static LedStatus fromCode(char code) {
        for (LedStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown LED status: " + code);
    }
}
