package com.questrail.lcn.protocol.pck;

/**
 * Base of all failures reported by {@link PckConnectionManager#connect()}.
 */
public class PckConnectionException extends RuntimeException {

    public PckConnectionException(String message) {
        super(message);
    }

    public PckConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
