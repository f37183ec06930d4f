package com.questrail.lcn.protocol.pck.model.input;

import java.util.Objects;

/**
 * Lines originating from the gateway itself rather than from a bus module.
 */
public sealed interface HostInput extends PckInput {

    /** Login prompt for the user name. */
    record AuthUsername() implements HostInput {}

    /** Login prompt for the password. */
    record AuthPassword() implements HostInput {}

    /** Credentials accepted. */
    record AuthOk() implements HostInput {}

    /** Credentials rejected; the gateway closes the socket afterwards. */
    record AuthFailed() implements HostInput {}

    /** The gateway lost or regained its connection to the bus. */
    record LcnConnState(boolean connected) implements HostInput {}

    /** The gateway has no license for another connection. */
    record LicenseError() implements HostInput {}

    /** The gateway confirmed decimal mode after {@code !CHD}. */
    record DecModeSet() implements HostInput {}

    /** The gateway could not interpret a command we sent. */
    record CommandError(String message) implements HostInput {
        public CommandError {
            Objects.requireNonNull(message, "message");
        }
    }

    /** Ping echo; {@code count} is -1 when the echo carried no counter. */
    record Ping(int count) implements HostInput {}
}
