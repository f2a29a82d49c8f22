package com.questrail.archon.emulator;

import com.questrail.archon.config.KeyValueConfigFile;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of the emulated controller.
 *
 * @param port              TCP port to listen on, 0 for an ephemeral port ({@code EMULATOR_PORT})
 * @param systemFile        file answered to SYSTEM, {@code null} when not configured ({@code EMULATOR_SYSTEM})
 * @param readoutTimeMillis nominal frame readout time ({@code READOUT_TIME})
 * @param exposeParam       parameter whose positive value starts exposures ({@code EXPOSE_PARAM})
 * @param abortParam        parameter whose positive value aborts ({@code ABORT_PARAM})
 * @param framesPerExposure frames read out for every exposure
 */
public record EmulatorConfig(
    int port,
    Path systemFile,
    int readoutTimeMillis,
    String exposeParam,
    String abortParam,
    int framesPerExposure
) {
    public static final int DEFAULT_PORT = 4242;

    public EmulatorConfig {
        Objects.requireNonNull(exposeParam, "exposeParam");
        Objects.requireNonNull(abortParam, "abortParam");
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (readoutTimeMillis < 0) {
            throw new IllegalArgumentException("readoutTimeMillis must be >= 0");
        }
        if (framesPerExposure <= 0) {
            throw new IllegalArgumentException("framesPerExposure must be > 0");
        }
    }

    public Optional<Path> system() {
        return Optional.ofNullable(systemFile);
    }

    public static EmulatorConfig fromFile(KeyValueConfigFile file) {
        Builder b = builder();
        b.withPort(file.getInt("EMULATOR_PORT", b.port));
        file.get("EMULATOR_SYSTEM").filter(s -> !s.isEmpty()).map(Path::of).ifPresent(b::withSystemFile);
        b.withReadoutTimeMillis(file.getInt("READOUT_TIME", b.readoutTimeMillis));
        file.get("EXPOSE_PARAM").ifPresent(b::withExposeParam);
        file.get("ABORT_PARAM").ifPresent(b::withAbortParam);
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int port = DEFAULT_PORT;
        private Path systemFile;
        private int readoutTimeMillis = 5000;
        private String exposeParam = "Expose";
        private String abortParam = "abort";
        private int framesPerExposure = 1;

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withSystemFile(Path systemFile) {
            this.systemFile = systemFile;
            return this;
        }

        public Builder withReadoutTimeMillis(int millis) {
            this.readoutTimeMillis = millis;
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

        public Builder withFramesPerExposure(int frames) {
            this.framesPerExposure = frames;
            return this;
        }

        public EmulatorConfig build() {
            return new EmulatorConfig(port, systemFile, readoutTimeMillis, exposeParam, abortParam, framesPerExposure);
        }
    }
}
