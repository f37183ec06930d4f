package com.questrail.lcn.protocol.pck;

/**
 * The gateway rejected the configured credentials.
 */
public class PckAuthenticationException extends PckConnectionException {

    public PckAuthenticationException(String message) {
        super(message);
    }
}
