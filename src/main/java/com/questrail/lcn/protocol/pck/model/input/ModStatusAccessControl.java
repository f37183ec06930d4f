package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.AccessControlPeriphery;
import com.questrail.lcn.protocol.pck.model.BatteryStatus;
import com.questrail.lcn.protocol.pck.model.KeyAction;
import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.Objects;

/**
 * Code read by a transmitter, transponder or fingerprint sensor.
 *
 * <p>
 * Only transmitter reports carry {@code level}, {@code key}, {@code action}
 * and {@code battery}; for the other peripherals they are {@code -1} /
 * {@code null}.
 * </p>
 */
public record ModStatusAccessControl(
        LcnAddress source,
        AccessControlPeriphery periphery,
        String code,
        int level,
        int key,
        KeyAction action,
        BatteryStatus battery
) implements ModInput {

    public ModStatusAccessControl {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(periphery, "periphery");
        Objects.requireNonNull(code, "code");
    }

    public static ModStatusAccessControl codeOnly(LcnAddress source, AccessControlPeriphery periphery, String code) {
        return new ModStatusAccessControl(source, periphery, code, -1, -1, null, null);
    }

    @Override
    public ModStatusAccessControl withSource(LcnAddress source) {
        return new ModStatusAccessControl(source, periphery, code, level, key, action, battery);
    }
}
