package com.questrail.lcn.protocol.pck.model.input;

/**
 * PckInput
 * =============================================================================
 * Closed set of everything the parser can produce from one inbound PCK line.
 *
 * <h2>Branches</h2>
 * <ul>
 *   <li>{@link HostInput}: gateway-originated lines (login prompts, bus state,
 *       pings, gateway errors). Consumed by the connection manager.</li>
 *   <li>{@link ModInput}: module-originated reports carrying a source address.
 *       Routed to the addressed device connection.</li>
 *   <li>{@link Unknown}: anything the parser does not recognize. Never an
 *       error.</li>
 * </ul>
 *
 * <p>
 * Consumers dispatch with {@code instanceof} patterns over this hierarchy; the
 * compiler knows the set is closed.
 * </p>
 */
public sealed interface PckInput permits HostInput, ModInput, Unknown {
}
