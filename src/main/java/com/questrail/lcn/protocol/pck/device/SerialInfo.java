package com.questrail.lcn.protocol.pck.device;

import com.questrail.lcn.protocol.pck.model.HardwareType;
import com.questrail.lcn.protocol.pck.model.input.ModSn;

import java.util.Objects;

/**
 * Identity and firmware of a module, learned from its serial number report.
 */
public record SerialInfo(long hardwareSerial, int manu, int softwareSerial, HardwareType hardwareType) {

    public SerialInfo {
        Objects.requireNonNull(hardwareType, "hardwareType");
    }

    public static SerialInfo from(ModSn sn) {
        return new SerialInfo(sn.hardwareSerial(), sn.manu(), sn.softwareSerial(), sn.hardwareType());
    }
}
