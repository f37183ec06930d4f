package com.questrail.lcn.protocol.pck.model;

/**
 * Output status reporting mode: percent (all gateway versions) or native
 * 0..200 steps.
 */
public enum OutputPortStatusMode {
    PERCENT('P'),
    NATIVE('N');

    private final char code;

    OutputPortStatusMode(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
