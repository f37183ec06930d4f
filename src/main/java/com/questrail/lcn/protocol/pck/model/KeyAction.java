package com.questrail.lcn.protocol.pck.model;

/**
 * Key actions reported by access control peripherals.
 */
public enum KeyAction {
    HIT,
    MAKE,
    BREAK
}
