package com.questrail.lcn.protocol.pck;

/**
 * The connection did not become ready before the connect deadline.
 */
public class PckConnectionTimeoutException extends PckConnectionException {

    public PckConnectionTimeoutException(String message) {
        super(message);
    }
}
