package com.questrail.lcn.protocol.pck;

/**
 * Authenticated, but the gateway never reported a connected bus before the
 * connect deadline.
 */
public class PckBusNotConnectedException extends PckConnectionTimeoutException {

    public PckBusNotConnectedException(String message) {
        super(message);
    }
}
