package com.questrail.gridlink.protocol.lludp.config;

import com.questrail.gridlink.protocol.lludp.circuit.CircuitTimingPolicy;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for the grid client transport.
 *
 * @param bindAddress          local address for each circuit's socket; port 0 is ephemeral
 * @param maxPacketSize        largest datagram sent, in bytes
 * @param maxDecodedPacketSize upper bound on a zero-decoded payload
 */
public record GridClientConfig(
    InetSocketAddress bindAddress,
    CircuitTimingPolicy timingPolicy,
    int maxPacketSize,
    int maxDecodedPacketSize
) {
    public static final int DEFAULT_MAX_PACKET_SIZE = 1200;
    public static final int DEFAULT_MAX_DECODED_PACKET_SIZE = 8192;

    public GridClientConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (maxPacketSize <= 0) {
            throw new IllegalArgumentException("maxPacketSize must be positive");
        }
        if (maxDecodedPacketSize < maxPacketSize) {
            throw new IllegalArgumentException("maxDecodedPacketSize must be >= maxPacketSize");
        }
    }

    public static GridClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private CircuitTimingPolicy timingPolicy = CircuitTimingPolicy.defaults();
        private int maxPacketSize = DEFAULT_MAX_PACKET_SIZE;
        private int maxDecodedPacketSize = DEFAULT_MAX_DECODED_PACKET_SIZE;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withTimingPolicy(CircuitTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withMaxPacketSize(int maxPacketSize) {
            this.maxPacketSize = maxPacketSize;
            return this;
        }

        public Builder withMaxDecodedPacketSize(int maxDecodedPacketSize) {
            this.maxDecodedPacketSize = maxDecodedPacketSize;
            return this;
        }

        public GridClientConfig build() {
            return new GridClientConfig(bindAddress, timingPolicy, maxPacketSize, maxDecodedPacketSize);
        }
    }
}
