package com.questrail.lcn.protocol.pck.model;

public enum BatteryStatus {
    FULL,
    WEAK
}
