package com.questrail.archon.runtime;

import com.questrail.archon.emulator.ArchonEmulator;
import com.questrail.archon.emulator.EmulatedController;
import com.questrail.archon.emulator.EmulatorConfig;
import com.questrail.archon.emulator.netty.NettyArchonEmulatorServer;
import com.questrail.archon.internal.time.MonotonicClock;
import com.questrail.archon.internal.time.SystemMonotonicClock;
import com.questrail.archon.observability.ArchonObservabilitySink;
import com.questrail.archon.observability.NullObservabilitySink;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * ArchonEmulatorRuntime
 * =============================================================================
 * Composition root and lifecycle owner of a running emulated controller.
 *
 * <pre>
 *   NettyArchonEmulatorServer  (TCP, one child channel per host connection)
 *        → ArchonEmulator       (command dispatch)
 *            → EmulatedController (configuration memory, frame ring, sequencer)
 * </pre>
 *
 * <p>No protocol semantics live here.</p>
 */
public final class ArchonEmulatorRuntime
{
    private final EmulatedController controller;
    private final NettyArchonEmulatorServer server;

    private ArchonEmulatorRuntime(EmulatedController controller, NettyArchonEmulatorServer server) {
        this.controller = controller;
        this.server = server;
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
        controller.close();
    }

    public int port() {
        return server.port();
    }

    public EmulatedController controller() {
        return controller;
    }

    public void awaitTermination() throws InterruptedException {
        server.awaitClose();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EmulatorConfig config = EmulatorConfig.builder().build();
        private ArchonObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private String bindHost;

        public Builder withConfig(EmulatorConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(ArchonObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Restricts the listener to one interface, e.g. {@code 127.0.0.1}. All interfaces by default.
         */
        public Builder withBindHost(String host) {
            this.bindHost = host;
            return this;
        }

        public ArchonEmulatorRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");

            EmulatedController controller = EmulatedController.create(config, clock, observabilitySink);
            ArchonEmulator emulator = new ArchonEmulator(controller, observabilitySink);
            InetSocketAddress address = bindHost == null
                    ? new InetSocketAddress(config.port())
                    : new InetSocketAddress(bindHost, config.port());
            NettyArchonEmulatorServer server = new NettyArchonEmulatorServer(address, emulator, observabilitySink);
            return new ArchonEmulatorRuntime(controller, server);
        }
    }
}
