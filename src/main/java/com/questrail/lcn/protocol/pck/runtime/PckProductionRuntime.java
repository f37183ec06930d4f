package com.questrail.lcn.protocol.pck.runtime;

import com.questrail.lcn.protocol.pck.PckConnectionManager;
import com.questrail.lcn.protocol.pck.codec.PckInputParser;
import com.questrail.lcn.protocol.pck.codec.impl.DefaultPckInputParser;
import com.questrail.lcn.protocol.pck.config.PckConnectionConfig;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicClock;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicScheduler;
import com.questrail.lcn.protocol.pck.internal.time.ScheduledExecutorScheduler;
import com.questrail.lcn.protocol.pck.internal.time.SystemMonotonicClock;
import com.questrail.lcn.protocol.pck.internal.time.SystemWallClock;
import com.questrail.lcn.protocol.pck.observability.NullObservabilitySink;
import com.questrail.lcn.protocol.pck.observability.PckObservabilitySink;
import com.questrail.lcn.protocol.pck.transport.LineEndpoint;
import com.questrail.lcn.protocol.pck.transport.tcp.netty.NettyTcpLineEndpoint;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * PckProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production PCK connection:
 * system clocks, a single-threaded scheduled executor for every timer, the
 * Netty TCP endpoint, the default parser and the connection manager.
 */
public final class PckProductionRuntime {
    private final PckConnectionManager manager;
    private final ScheduledExecutorService schedulerExecutor;

    private PckProductionRuntime(PckConnectionManager manager, ScheduledExecutorService schedulerExecutor) {
        this.manager = manager;
        this.schedulerExecutor = schedulerExecutor;
    }

    /**
     * Opens the connection.
     *
     * @return completes once the connection is ready; see
     *         {@link PckConnectionManager#connect()}
     */
    public CompletableFuture<Void> start() {
        return manager.connect();
    }

    public void stop() {
        manager.close();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public PckConnectionManager connection() {
        return manager;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PckConnectionConfig config;
        private PckObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private PckInputParser parser;
        private LineEndpoint endpoint;

        public Builder withConfig(PckConnectionConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(PckObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withParser(PckInputParser parser) {
            this.parser = parser;
            return this;
        }

        /**
         * Replaces the Netty endpoint, for example with an in-memory one.
         */
        public Builder withEndpoint(LineEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public PckProductionRuntime build() {
            Objects.requireNonNull(config, "config");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "pck-scheduler");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            LineEndpoint effectiveEndpoint = endpoint != null
                    ? endpoint
                    : new NettyTcpLineEndpoint(InetSocketAddress.createUnresolved(config.host(), config.port()),
                                               config.connectTimeout());
            PckInputParser effectiveParser = parser != null ? parser : new DefaultPckInputParser();

            PckConnectionManager manager = new PckConnectionManager(
                config,
                effectiveEndpoint,
                effectiveParser,
                scheduler,
                clock,
                SystemWallClock.INSTANCE,
                observabilitySink
            );

            return new PckProductionRuntime(manager, schedulerExec);
        }
    }
}
