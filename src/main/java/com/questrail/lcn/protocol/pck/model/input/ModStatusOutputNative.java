package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.Map;
import java.util.Objects;

/**
 * Output level in native steps (0..200). {@code outputId} is zero-based.
 */
public record ModStatusOutputNative(LcnAddress source, int outputId, int value) implements ModInput {
    public ModStatusOutputNative {
        Objects.requireNonNull(source, "source");
    }

    @Override
    public ModStatusOutputNative withSource(LcnAddress source) {
        return new ModStatusOutputNative(source, outputId, value);
    }

    @Override
    public Map<String, Object> correlationFields() {
        return Map.of("outputId", outputId);
    }
}
