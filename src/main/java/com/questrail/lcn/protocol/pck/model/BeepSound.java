package com.questrail.lcn.protocol.pck.model;

public enum BeepSound {
    NORMAL('N'),
    SPECIAL('S');

    private final char code;

    BeepSound(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
