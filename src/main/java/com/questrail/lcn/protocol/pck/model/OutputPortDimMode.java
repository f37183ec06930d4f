package com.questrail.lcn.protocol.pck.model;

/**
 * Dimming resolution negotiated with the gateway: 50 steps (all module
 * generations) or 200 steps (firmware 170206 and later).
 */
public enum OutputPortDimMode {
    STEPS50,
    STEPS200
}
