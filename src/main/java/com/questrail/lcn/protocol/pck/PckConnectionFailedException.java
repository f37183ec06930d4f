package com.questrail.lcn.protocol.pck;

/**
 * The transport could not be opened or went down before the connection was
 * ready.
 */
public class PckConnectionFailedException extends PckConnectionException {

    public PckConnectionFailedException(String message) {
        super(message);
    }

    public PckConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
