/**
 * PCK wire codec.
 * =============================================================================
 *
 * <p>{@link com.questrail.lcn.protocol.pck.codec.PckInputParser} turns inbound
 * lines into {@link com.questrail.lcn.protocol.pck.model.input.PckInput}
 * values; {@link com.questrail.lcn.protocol.pck.codec.PckGenerator} builds
 * outbound command bodies. Both are stateless.</p>
 *
 * <p>Numeric fields have fixed, zero-padded widths on the wire. A generator
 * result with a different width is a bug.</p>
 */
package com.questrail.lcn.protocol.pck.codec;
