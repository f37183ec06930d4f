package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.Map;
import java.util.Objects;

/**
 * Output level in percent. {@code outputId} is zero-based.
 */
public record ModStatusOutput(LcnAddress source, int outputId, double percent) implements ModInput {
    public ModStatusOutput {
        Objects.requireNonNull(source, "source");
    }

    @Override
    public ModStatusOutput withSource(LcnAddress source) {
        return new ModStatusOutput(source, outputId, percent);
    }

    @Override
    public Map<String, Object> correlationFields() {
        return Map.of("outputId", outputId);
    }
}
