package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.Objects;

/**
 * Segment coupler report: the module reports the segment it lives on.
 */
public record ModSk(LcnAddress source, int reportedSegmentId) implements ModInput {
    public ModSk {
        Objects.requireNonNull(source, "source");
    }

    @Override
    public ModSk withSource(LcnAddress source) {
        return new ModSk(source, reportedSegmentId);
    }
}
