package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.List;
import java.util.Objects;

/**
 * "Send command to host" ({@code SKH}): 2, 6 or 14 byte parameters.
 */
public record ModSendCommandHost(LcnAddress source, List<Integer> parameters) implements ModInput {
    public ModSendCommandHost {
        Objects.requireNonNull(source, "source");
        parameters = List.copyOf(parameters);
    }

    @Override
    public ModSendCommandHost withSource(LcnAddress source) {
        return new ModSendCommandHost(source, parameters);
    }
}
