package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stored output values and ramps of a scene.
 */
public record ModStatusSceneOutputs(LcnAddress source, int sceneId, List<Integer> values, List<Integer> ramps)
        implements ModInput {

    public ModStatusSceneOutputs {
        Objects.requireNonNull(source, "source");
        values = List.copyOf(values);
        ramps = List.copyOf(ramps);
    }

    @Override
    public ModStatusSceneOutputs withSource(LcnAddress source) {
        return new ModStatusSceneOutputs(source, sceneId, values, ramps);
    }

    @Override
    public Map<String, Object> correlationFields() {
        return Map.of("sceneId", sceneId);
    }
}
