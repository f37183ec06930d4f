package com.questrail.lcn.protocol.pck.config;

import com.questrail.lcn.protocol.pck.internal.exec.PckTimingPolicy;
import com.questrail.lcn.protocol.pck.model.OutputPortDimMode;
import com.questrail.lcn.protocol.pck.model.OutputPortStatusMode;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration of one PCK gateway connection.
 *
 * <p>{@link #toString()} masks the password.</p>
 */
public record PckConnectionConfig(
    String host,
    int port,
    String username,
    String password,
    PckTimingPolicy timingPolicy,
    int numTries,
    int segmentScanTries,
    OutputPortDimMode dimMode,
    OutputPortStatusMode statusMode,
    boolean acknowledge,
    int maxParallelRequests,
    Duration connectTimeout
) {
    public static final int DEFAULT_PORT = 4114;

    public PckConnectionConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(dimMode, "dimMode");
        Objects.requireNonNull(statusMode, "statusMode");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be in range 1..65535");
        }
        if (numTries < 0) {
            throw new IllegalArgumentException("numTries must be non-negative");
        }
        if (segmentScanTries < 0) {
            throw new IllegalArgumentException("segmentScanTries must be non-negative");
        }
        if (maxParallelRequests < 1) {
            throw new IllegalArgumentException("maxParallelRequests must be positive");
        }
        if (connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be non-negative");
        }
    }

    @Override
    public String toString() {
        return "PckConnectionConfig[host=" + host
                + ", port=" + port
                + ", username=" + username
                + ", password=****"
                + ", timingPolicy=" + timingPolicy
                + ", numTries=" + numTries
                + ", segmentScanTries=" + segmentScanTries
                + ", dimMode=" + dimMode
                + ", statusMode=" + statusMode
                + ", acknowledge=" + acknowledge
                + ", maxParallelRequests=" + maxParallelRequests
                + ", connectTimeout=" + connectTimeout + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private String username = "lcn";
        private String password = "lcn";
        private PckTimingPolicy timingPolicy = PckTimingPolicy.defaults();
        private int numTries = 3;
        private int segmentScanTries = 3;
        private OutputPortDimMode dimMode = OutputPortDimMode.STEPS50;
        private OutputPortStatusMode statusMode = OutputPortStatusMode.PERCENT;
        private boolean acknowledge = true;
        private int maxParallelRequests = 16;
        private Duration connectTimeout = Duration.ofSeconds(30);

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withTimingPolicy(PckTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withNumTries(int numTries) {
            this.numTries = numTries;
            return this;
        }

        public Builder withSegmentScanTries(int segmentScanTries) {
            this.segmentScanTries = segmentScanTries;
            return this;
        }

        public Builder withDimMode(OutputPortDimMode dimMode) {
            this.dimMode = dimMode;
            return this;
        }

        public Builder withStatusMode(OutputPortStatusMode statusMode) {
            this.statusMode = statusMode;
            return this;
        }

        public Builder withAcknowledge(boolean acknowledge) {
            this.acknowledge = acknowledge;
            return this;
        }

        public Builder withMaxParallelRequests(int maxParallelRequests) {
            this.maxParallelRequests = maxParallelRequests;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public PckConnectionConfig build() {
            return new PckConnectionConfig(host, port, username, password, timingPolicy, numTries,
                    segmentScanTries, dimMode, statusMode, acknowledge, maxParallelRequests, connectTimeout);
        }
    }
}
