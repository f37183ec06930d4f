package com.questrail.lcn.protocol.pck.transport;

/**
 * LineEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link LineEndpoint}.
 *
 * <p>Callbacks are delivered serialized and in arrival order. The Netty
 * endpoint delivers them on the channel's event loop.</p>
 */
public interface LineEndpointListener
{
    /**
     * Called when the connection is established.
     */
    void onTransportUp();

    /**
     * Called when the connection is lost, closed or could not be opened.
     *
     * @param cause the failure; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for every received line, already decoded and stripped of its
     * terminator.
     */
    void onLine(String line);
}
