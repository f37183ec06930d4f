package com.questrail.lcn.protocol.pck.model;

/**
 * Per-key modifier characters of the {@code TX} lock commands.
 */
public enum KeyLockStateModifier {
    ON('1'),
    OFF('0'),
    TOGGLE('U'),
    NOCHANGE('-');

    private final char code;

    KeyLockStateModifier(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
