package com.questrail.lcn.protocol.pck.model;

public enum AccessControlPeriphery {
    TRANSMITTER,
    TRANSPONDER,
    FINGERPRINT,
    CODELOCK
}
