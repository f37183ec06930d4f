package com.questrail.lcn.protocol.pck.model;

/**
 * Logic operation (sum) states as reported in {@code TL} messages.
 */
public enum LogicOpStatus {
    NONE('N'),
    SOME('T'),
    ALL('V');

    private final char code;

    LogicOpStatus(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static LogicOpStatus fromCode(char code) {
        for (LogicOpStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown logic operation status: " + code);
    }
}
