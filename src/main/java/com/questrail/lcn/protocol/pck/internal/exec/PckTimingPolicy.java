package com.questrail.lcn.protocol.pck.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * PckTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing of the PCK client.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>defaultTimeout</b> Wait between retries of acknowledged commands
 *       and status requests, and the bound on a caller's status wait.</li>
 *   <li><b>maxStatusEventBasedValueAge</b> Poll interval for values the
 *       module reports on change by itself (outputs, relays, binary sensors,
 *       variables on new firmware).</li>
 *   <li><b>maxStatusPolledValueAge</b> Poll interval for values that are only
 *       reported on request (LEDs, key locks, variables on old firmware).</li>
 *   <li><b>pingInterval</b> Keepalive cadence. The gateway drops idle
 *       connections after ten minutes.</li>
 *   <li><b>pingTimeout</b> How long a keepalive reply may take before
 *       {@code PING_TIMEOUT} is reported.</li>
 *   <li><b>maxResponseAge</b> Lifetime of cached status responses and the
 *       period of cache pruning.</li>
 *   <li><b>segmentScanTimeout</b> Wait between segment coupler scan
 *       attempts.</li>
 *   <li><b>moduleScanTimeout</b> Wait between module discovery broadcasts.</li>
 * </ul>
 */
public record PckTimingPolicy(
        Duration defaultTimeout,
        Duration maxStatusEventBasedValueAge,
        Duration maxStatusPolledValueAge,
        Duration pingInterval,
        Duration pingTimeout,
        Duration maxResponseAge,
        Duration segmentScanTimeout,
        Duration moduleScanTimeout
) {
    public PckTimingPolicy {
        requireNonNegative(defaultTimeout, "defaultTimeout");
        requireNonNegative(maxStatusEventBasedValueAge, "maxStatusEventBasedValueAge");
        requireNonNegative(maxStatusPolledValueAge, "maxStatusPolledValueAge");
        requireNonNegative(pingInterval, "pingInterval");
        requireNonNegative(pingTimeout, "pingTimeout");
        requireNonNegative(maxResponseAge, "maxResponseAge");
        requireNonNegative(segmentScanTimeout, "segmentScanTimeout");
        requireNonNegative(moduleScanTimeout, "moduleScanTimeout");
    }

    /**
     * Defaults matching the gateway's behavior:
     * <ul>
     *   <li>defaultTimeout: 3.5s</li>
     *   <li>maxStatusEventBasedValueAge: 600s</li>
     *   <li>maxStatusPolledValueAge: 30s</li>
     *   <li>pingInterval: 600s</li>
     *   <li>pingTimeout: 10s</li>
     *   <li>maxResponseAge: 60s</li>
     *   <li>segmentScanTimeout: 1.5s</li>
     *   <li>moduleScanTimeout: 3s</li>
     * </ul>
     */
    public static PckTimingPolicy defaults() {
        return new PckTimingPolicy(
                Duration.ofMillis(3500),
                Duration.ofSeconds(600),
                Duration.ofSeconds(30),
                Duration.ofSeconds(600),
                Duration.ofSeconds(10),
                Duration.ofSeconds(60),
                Duration.ofMillis(1500),
                Duration.ofSeconds(3)
        );
    }

    public PckTimingPolicy withDefaultTimeout(Duration defaultTimeout) {
        return new PckTimingPolicy(
                defaultTimeout,
                maxStatusEventBasedValueAge,
                maxStatusPolledValueAge,
                pingInterval,
                pingTimeout,
                maxResponseAge,
                segmentScanTimeout,
                moduleScanTimeout
        );
    }

    private static void requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
