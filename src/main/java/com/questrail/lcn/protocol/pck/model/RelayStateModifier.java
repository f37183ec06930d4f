package com.questrail.lcn.protocol.pck.model;

/**
 * Per-relay modifier characters of the {@code R8} command.
 */
public enum RelayStateModifier {
    ON('1'),
    OFF('0'),
    TOGGLE('U'),
    NOCHANGE('-');

    private final char code;

    RelayStateModifier(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
