package com.questrail.archon.client;

import com.questrail.archon.config.KeyValueConfigFile;

import java.util.Objects;

/**
 * Connection and exposure settings for an {@link ArchonController}.
 *
 * <p>Loaded from the server configuration file by {@link #fromFile}; keys not
 * present keep their builder defaults.</p>
 *
 * @param host                 controller host name or address ({@code ARCHON_IP})
 * @param port                 controller TCP port ({@code ARCHON_PORT})
 * @param connectTimeoutMillis TCP connect timeout
 * @param replyTimeoutMillis   time allowed for one reply line or one FETCH block
 * @param readoutTimeoutMillis time allowed for a new frame to appear ({@code READOUT_TIME})
 * @param framePollMillis      pause between FRAME queries while waiting for a frame
 * @param exposeParam          parameter that starts an exposure ({@code EXPOSE_PARAM})
 * @param abortParam           parameter that aborts an exposure ({@code ABORT_PARAM})
 */
public record ArchonClientConfig(
    String host,
    int port,
    int connectTimeoutMillis,
    int replyTimeoutMillis,
    int readoutTimeoutMillis,
    int framePollMillis,
    String exposeParam,
    String abortParam
) {
    public static final int DEFAULT_PORT = 4242;

    public ArchonClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(exposeParam, "exposeParam");
        Objects.requireNonNull(abortParam, "abortParam");
        if (port <= 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (connectTimeoutMillis < 0 || replyTimeoutMillis <= 0 || readoutTimeoutMillis <= 0 || framePollMillis < 0) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
    }

    public static ArchonClientConfig fromFile(KeyValueConfigFile file) {
        Builder b = builder();
        file.get("ARCHON_IP").ifPresent(b::withHost);
        b.withPort(file.getInt("ARCHON_PORT", b.port));
        b.withReadoutTimeoutMillis(file.getInt("READOUT_TIME", b.readoutTimeoutMillis));
        file.get("EXPOSE_PARAM").ifPresent(b::withExposeParam);
        file.get("ABORT_PARAM").ifPresent(b::withAbortParam);
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = DEFAULT_PORT;
        private int connectTimeoutMillis = 5000;
        private int replyTimeoutMillis = 5000;
        private int readoutTimeoutMillis = 5000;
        private int framePollMillis = 10;
        private String exposeParam = "Expose";
        private String abortParam = "abort";

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withConnectTimeoutMillis(int millis) {
            this.connectTimeoutMillis = millis;
            return this;
        }

        public Builder withReplyTimeoutMillis(int millis) {
            this.replyTimeoutMillis = millis;
            return this;
        }

        public Builder withReadoutTimeoutMillis(int millis) {
            this.readoutTimeoutMillis = millis;
            return this;
        }

        public Builder withFramePollMillis(int millis) {
            this.framePollMillis = millis;
            return this;
        }

        public Builder withExposeParam(String exposeParam) {
            this.exposeParam = exposeParam;
            return this;
        }

        public Builder withAbortParam(String abortParam) {
            this.abortParam = abortParam;
            return this;
        }

        public ArchonClientConfig build() {
            return new ArchonClientConfig(host, port, connectTimeoutMillis, replyTimeoutMillis,
                    readoutTimeoutMillis, framePollMillis, exposeParam, abortParam);
        }
    }
}
