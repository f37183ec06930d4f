package com.questrail.lcn.protocol.pck.model;

/**
 * Key action characters used when sending keys.
 */
public enum SendKeyCommand {
    HIT('K'),
    MAKE('L'),
    BREAK('O'),
    DONTSEND('-');

    private final char code;

    SendKeyCommand(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
