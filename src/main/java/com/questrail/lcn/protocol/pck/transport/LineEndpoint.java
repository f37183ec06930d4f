package com.questrail.lcn.protocol.pck.transport;

/**
 * LineEndpoint
 * -----------------------------------------------------------------------------
 * Port for a line-oriented, connection-based transport to a PCK gateway.
 *
 * <p>The endpoint frames the byte stream into lines and nothing more. The
 * connection manager above it is responsible for:</p>
 * <ul>
 *   <li>parsing inbound lines into PCK inputs</li>
 *   <li>the login handshake and bus state tracking</li>
 *   <li>keepalive, retries and timeouts</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface LineEndpoint
{
    /**
     * Open the connection.
     *
     * <p>When the connection is established the endpoint MUST notify its
     * listener via {@link LineEndpointListener#onTransportUp()}; when it cannot
     * be established, via {@link LineEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Close the connection and release all transport resources.
     *
     * <p>The listener receives {@link LineEndpointListener#onTransportDown(Throwable)}
     * at most once per up/down transition.</p>
     */
    void stop();

    /**
     * Write one line. The line terminator is appended by the endpoint.
     *
     * <p>Lines written while the connection is down are dropped.</p>
     *
     * @param line line content without terminator
     */
    void send(String line);

    /**
     * Register the listener that receives inbound lines and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(LineEndpointListener listener);
}
