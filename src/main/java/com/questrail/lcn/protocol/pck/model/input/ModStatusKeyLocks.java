package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.List;
import java.util.Objects;

/**
 * Key lock states per key table (A..C, and D on newer modules), 8 keys each.
 */
public record ModStatusKeyLocks(LcnAddress source, List<List<Boolean>> states) implements ModInput {
    public ModStatusKeyLocks {
        Objects.requireNonNull(source, "source");
        states = states.stream().map(List::copyOf).toList();
    }

    @Override
    public ModStatusKeyLocks withSource(LcnAddress source) {
        return new ModStatusKeyLocks(source, states);
    }
}
