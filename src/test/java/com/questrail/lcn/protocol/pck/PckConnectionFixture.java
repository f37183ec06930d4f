package com.questrail.lcn.protocol.pck;

import com.questrail.lcn.protocol.pck.codec.impl.DefaultPckInputParser;
import com.questrail.lcn.protocol.pck.config.PckConnectionConfig;
import com.questrail.lcn.protocol.pck.internal.exec.PckTimingPolicy;
import com.questrail.lcn.protocol.pck.internal.time.SystemWallClock;
import com.questrail.lcn.protocol.pck.observability.RecordingObservabilitySink;
import com.questrail.lcn.protocol.pck.time.ManualTime;
import com.questrail.lcn.protocol.pck.transport.FakeLineEndpoint;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * A {@link PckConnectionManager} wired to a {@link FakeLineEndpoint} and a
 * manual clock, plus helpers that play the gateway's side of the login.
 */
public final class PckConnectionFixture {

    /**
     * Short timeouts so tests can advance through them quickly.
     */
    public static final PckTimingPolicy TIMING = new PckTimingPolicy(
            Duration.ofMillis(100),     // defaultTimeout
            Duration.ofMillis(10_000),  // maxStatusEventBasedValueAge
            Duration.ofMillis(1_000),   // maxStatusPolledValueAge
            Duration.ofMillis(10_000),  // pingInterval
            Duration.ofMillis(2_000),   // pingTimeout
            Duration.ofMillis(60_000),  // maxResponseAge
            Duration.ofMillis(50),      // segmentScanTimeout
            Duration.ofMillis(200));    // moduleScanTimeout

    public final ManualTime time = new ManualTime();
    public final FakeLineEndpoint endpoint = new FakeLineEndpoint();
    public final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    public final PckConnectionConfig config;
    public final PckConnectionManager manager;

    public PckConnectionFixture() {
        this(config().build());
    }

    public PckConnectionFixture(PckConnectionConfig config) {
        this.config = config;
        this.manager = new PckConnectionManager(config, endpoint, new DefaultPckInputParser(),
                time.scheduler(), time.clock(), SystemWallClock.INSTANCE, sink);
    }

    public static PckConnectionConfig.Builder config() {
        return PckConnectionConfig.builder()
                .withHost("gateway")
                .withUsername("user")
                .withPassword("secret")
                .withTimingPolicy(TIMING)
                .withConnectTimeout(Duration.ofSeconds(5));
    }

    /**
     * Connects and answers the login prompts. The bus is still down.
     */
    public CompletableFuture<Void> login() {
        CompletableFuture<Void> connected = manager.connect();
        endpoint.inject("Username:", "Password:", "OK", "(dec-mode)");
        return connected;
    }

    /**
     * Reports a connected bus and lets the first ping and segment scan go out.
     */
    public void busUp() {
        endpoint.inject("$io:#LCN:connected");
        time.runDue();
    }

    /**
     * Answers the segment scan with {@code segmentId} from the local segment.
     */
    public void segmentReport(int segmentId) {
        endpoint.inject(String.format("=M000010.SK%03d", segmentId));
        time.runDue();
    }

    /**
     * Login, bus up and local segment {@code segmentId}; clears the sent lines.
     */
    public CompletableFuture<Void> ready(int segmentId) {
        CompletableFuture<Void> connected = login();
        busUp();
        segmentReport(segmentId);
        endpoint.clear();
        return connected;
    }

    /** Sent lines addressed to modules or groups. */
    public List<String> busLines() {
        return endpoint.sent().stream()
                .filter(line -> line.startsWith(">"))
                .collect(Collectors.toList());
    }

    /** Sent lines starting with {@code prefix}. */
    public List<String> sentStartingWith(String prefix) {
        return endpoint.sent().stream()
                .filter(line -> line.startsWith(prefix))
                .collect(Collectors.toList());
    }
}
