package com.questrail.lcn.protocol.pck.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Strongly typed representation of an LCN bus address.
 *
 * <h2>Shape</h2>
 * <p>
 * An address names either a single <em>module</em> or a <em>group</em> of
 * modules on a numbered bus segment. Segment {@code 0} is the physical
 * placeholder for "the segment the gateway is attached to"; once the local
 * segment id has been discovered, addresses can be translated between their
 * physical (wire) and logical (application) forms.
 * </p>
 *
 * <h2>Validity</h2>
 * <ul>
 *   <li>Modules: {@code 0 <= segmentId <= 128} and {@code 1 <= entityId < 254}</li>
 *   <li>Groups: {@code 0 <= segmentId <= 128} and {@code 3 <= entityId < 254}</li>
 * </ul>
 *
 * <p>
 * Out-of-range values are representable; {@link #isValid()} reports them.
 * Callers must check validity before addressing a command.
 * </p>
 *
 * <p>
 * Instances are immutable and compare structurally.
 * </p>
 */
public final class LcnAddress
{
    /** Highest segment id a coupler may report. */
    public static final int MAX_SEGMENT_ID = 128;

    /** Segment id used by modules when reporting to the host via broadcast. */
    public static final int BROADCAST_SEGMENT_ID = 4;

    private final int segmentId;
    private final int entityId;
    private final boolean group;

    private LcnAddress(int segmentId, int entityId, boolean group) {
        this.segmentId = segmentId;
        this.entityId = entityId;
        this.group = group;
    }

    public static LcnAddress of(int segmentId, int entityId, boolean group) {
        return new LcnAddress(segmentId, entityId, group);
    }

    public static LcnAddress module(int segmentId, int moduleId) {
        return new LcnAddress(segmentId, moduleId, false);
    }

    public static LcnAddress group(int segmentId, int groupId) {
        return new LcnAddress(segmentId, groupId, true);
    }

    public int segmentId() {
        return segmentId;
    }

    public int entityId() {
        return entityId;
    }

    public boolean isGroup() {
        return group;
    }

    /**
     * Checks the address against the bus addressing rules.
     */
    public boolean isValid() {
        if (segmentId < 0 || segmentId > MAX_SEGMENT_ID) {
            return false;
        }
        if (group) {
            return entityId >= 3 && entityId < 254;
        }
        return entityId >= 1 && entityId < 254;
    }

    /**
     * Translates a physical address into its logical form.
     *
     * <p>
     * Segment {@code 0} (and the broadcast segment modules use when reporting
     * to the host) is replaced by the local segment id once that id is known.
     * While the local segment id is unknown ({@code -1}) the address is returned
     * unchanged.
     * </p>
     *
     * @param localSegmentId discovered local segment id, or {@code -1}
     * @return the logical address (possibly {@code this})
     */
    public LcnAddress physicalToLogical(int localSegmentId) {
        if (localSegmentId < 0) {
            return this;
        }
        if (segmentId == 0 || segmentId == BROADCAST_SEGMENT_ID) {
            if (segmentId == localSegmentId) {
                return this;
            }
            return new LcnAddress(localSegmentId, entityId, group);
        }
        return this;
    }

    /**
     * Returns the segment id to put on the wire: {@code 0} when the address
     * lives on the local segment, otherwise its own segment id.
     */
    public int getPhysicalSegmentId(int localSegmentId) {
        return segmentId == localSegmentId ? 0 : segmentId;
    }

    /**
     * Returns a copy of this address on another segment.
     */
    public LcnAddress withSegmentId(int newSegmentId) {
        return new LcnAddress(newSegmentId, entityId, group);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LcnAddress that)) return false;
        return segmentId == that.segmentId
                && entityId == that.entityId
                && group == that.group;
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentId, entityId, group);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s%03d%03d", group ? "G" : "M", segmentId, entityId);
    }
}
