package com.questrail.lcn.protocol.pck;

/**
 * The gateway has no license left for another client connection.
 */
public class PckLicenseException extends PckConnectionException {

    public PckLicenseException(String message) {
        super(message);
    }
}
