package com.questrail.lcn.protocol.pck.model;

/**
 * Reverse delay of a motor driven through outputs.
 */
public enum MotorReverseTime {
    RT70,
    RT600,
    RT1200
}
