package com.questrail.archon.runtime;

import com.questrail.archon.config.KeyValueConfigFile;
import com.questrail.archon.emulator.EmulatorConfig;
import com.questrail.archon.observability.Slf4jArchonObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Starts an emulated Archon from a server configuration file.
 *
 * <pre>
 *   java -cp ... com.questrail.archon.runtime.ArchonEmulatorMain demo.cfg
 * </pre>
 */
public final class ArchonEmulatorMain
{
    private static final Logger log = LoggerFactory.getLogger(ArchonEmulatorMain.class);

    private ArchonEmulatorMain() {}

    public static void main(String[] args) throws InterruptedException {
        if (args.length != 1) {
            System.err.println("usage: ArchonEmulatorMain <configfile>");
            System.exit(2);
        }

        EmulatorConfig config;
        try {
            config = EmulatorConfig.fromFile(KeyValueConfigFile.load(Path.of(args[0])));
        }
        catch (IOException | IllegalArgumentException e) {
            log.error("Cannot load configuration {}", args[0], e);
            System.exit(1);
            return;
        }

        ArchonEmulatorRuntime runtime = ArchonEmulatorRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jArchonObservabilitySink())
                .build();
        runtime.start();
        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "archon-emulator-shutdown"));
        log.info("Archon emulator started on port {}", runtime.port());
        runtime.awaitTermination();
    }
}
