/**
 * PCK Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty TCP or a test double) and the PCK connection manager.
 *
 * <h2>Netty containment</h2>
 * Netty is used in production for its event loop model and line framing, but
 * its types never leave {@code transport.tcp.netty}. Everything above the
 * adapter sees only:
 * <ul>
 *   <li>decoded lines as {@code String}</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and line framing only</li>
 *   <li>Not parse PCK messages</li>
 *   <li>Not schedule retries, pings or timeouts</li>
 * </ul>
 */
package com.questrail.lcn.protocol.pck.transport;
