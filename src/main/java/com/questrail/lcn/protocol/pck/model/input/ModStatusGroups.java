package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static ({@code GP}) or dynamic ({@code GD}) group memberships.
 */
public record ModStatusGroups(LcnAddress source, boolean dynamic, int maxGroups, List<LcnAddress> groups)
        implements ModInput {

    public ModStatusGroups {
        Objects.requireNonNull(source, "source");
        groups = List.copyOf(groups);
    }

    @Override
    public ModStatusGroups withSource(LcnAddress source) {
        return new ModStatusGroups(source, dynamic, maxGroups, groups);
    }

    @Override
    public Map<String, Object> correlationFields() {
        return Map.of("dynamic", dynamic);
    }
}
