package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.LedStatus;
import com.questrail.lcn.protocol.pck.model.LogicOpStatus;

import java.util.List;
import java.util.Objects;

/**
 * States of the 12 LEDs and 4 logic operations.
 */
public record ModStatusLedsAndLogicOps(LcnAddress source, List<LedStatus> leds, List<LogicOpStatus> logicOps)
        implements ModInput {

    public ModStatusLedsAndLogicOps {
        Objects.requireNonNull(source, "source");
        leds = List.copyOf(leds);
        logicOps = List.copyOf(logicOps);
    }

    @Override
    public ModStatusLedsAndLogicOps withSource(LcnAddress source) {
        return new ModStatusLedsAndLogicOps(source, leds, logicOps);
    }
}
