package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.HardwareType;
import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.Objects;

/**
 * Serial number report. {@code softwareSerial} is the firmware age used to
 * select wire encodings.
 */
public record ModSn(
        LcnAddress source,
        long hardwareSerial,
        int manu,
        int softwareSerial,
        HardwareType hardwareType
) implements ModInput {
    public ModSn {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(hardwareType, "hardwareType");
    }

    @Override
    public ModSn withSource(LcnAddress source) {
        return new ModSn(source, hardwareSerial, manu, softwareSerial, hardwareType);
    }
}
