package com.questrail.lcn.protocol.pck.model;

/**
 * Reference point for relative variable changes: the current value or the
 * programmed value (set-points and thresholds only).
 */
public enum RelVarRef {
    CURRENT,
    PROG
}
