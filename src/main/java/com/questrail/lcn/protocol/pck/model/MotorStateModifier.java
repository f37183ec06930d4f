package com.questrail.lcn.protocol.pck.model;

/**
 * Motor actions. A motor occupies two relays (on/off and direction) or the
 * first two outputs.
 */
public enum MotorStateModifier {
    UP,
    DOWN,
    STOP,
    TOGGLEONOFF,
    TOGGLEDIR,
    CYCLE,
    NOCHANGE
}
