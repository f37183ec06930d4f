package com.questrail.lcn.protocol.pck;

/**
 * States of the gateway connection, in the order a successful connect passes
 * through them.
 *
 * <pre>
 *   DISCONNECTED -&gt; SOCKET_CONNECTING -&gt; SOCKET_CONNECTED
 *     -&gt; AWAITING_USERNAME -&gt; AWAITING_PASSWORD -&gt; AUTHENTICATED
 *     -&gt; BUS_DISCONNECTED | BUS_CONNECTED -&gt; SCANNING_SEGMENT -&gt; READY
 * </pre>
 *
 * A bus disconnect from {@code BUS_CONNECTED}, {@code SCANNING_SEGMENT} or
 * {@code READY} leads back to {@code BUS_DISCONNECTED}; losing the socket
 * leads to {@code DISCONNECTED} from anywhere.
 */
public enum PckConnectionState {
    DISCONNECTED,
    SOCKET_CONNECTING,
    SOCKET_CONNECTED,
    AWAITING_USERNAME,
    AWAITING_PASSWORD,
    AUTHENTICATED,
    BUS_DISCONNECTED,
    BUS_CONNECTED,
    SCANNING_SEGMENT,
    READY;

    /** {@code true} once the gateway accepted the credentials. */
    public boolean isAuthenticated() {
        return ordinal() >= AUTHENTICATED.ordinal();
    }
}
