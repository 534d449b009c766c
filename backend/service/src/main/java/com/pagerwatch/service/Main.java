package com.pagerwatch.service;

import com.pagerwatch.core.bus.EventBus;
import com.pagerwatch.core.error.CapcodeLoadException;
import com.pagerwatch.core.error.IngestionLostException;
import com.pagerwatch.core.error.StoreIoException;
import com.pagerwatch.pipeline.capcode.CapcodeRegistry;
import com.pagerwatch.pipeline.parse.LineParser;
import com.pagerwatch.service.api.AlertStreamHandler;
import com.pagerwatch.service.api.ApiServer;
import com.pagerwatch.service.api.DiagnosticsTracker;
import com.pagerwatch.service.config.ConfigLoader;
import com.pagerwatch.service.config.MonitorConfig;
import com.pagerwatch.service.hub.BroadcastHub;
import com.pagerwatch.service.ingest.DecoderSource;
import com.pagerwatch.service.ingest.DecoderSources;
import com.pagerwatch.service.ingest.IngestionLoop;
import com.pagerwatch.service.runtime.LoggingSetup;
import com.pagerwatch.service.runtime.MaintenanceScheduler;
import com.pagerwatch.service.store.RetentionStore;
import com.pagerwatch.service.store.SnapshotFile;
import com.pagerwatch.service.store.SnapshotFlusher;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_STARTUP_FAILED = 1;
    static final int EXIT_INGESTION_LOST = 2;

    private Main() {
    }

    public static void main(String[] args) {
        RuntimeFlags runtimeFlags = resolveRuntimeFlags(args, System.getenv(), LOGGER::warning);
        LoggingSetup.configure(runtimeFlags.verbose());
        System.exit(run(runtimeFlags));
    }

    static int run(RuntimeFlags runtimeFlags) {
        Clock clock = Clock.systemUTC();
        MonitorConfig config;
        try {
            config = ConfigLoader.loadMonitor(runtimeFlags.configDir());
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Startup failed: " + e.getMessage(), e);
            return EXIT_STARTUP_FAILED;
        }
        if (runtimeFlags.httpPort() != null) {
            config = config.withHttpPort(runtimeFlags.httpPort());
        }

        EventBus eventBus = new EventBus((event, error) ->
                LOGGER.log(Level.WARNING, "Diagnostics handler failed for " + event.type(), error));

        SnapshotFile snapshotFile = new SnapshotFile(Path.of(config.historyFile()));
        RetentionStore store;
        try {
            store = RetentionStore.restore(clock, config.retention(), snapshotFile.read());
        } catch (StoreIoException e) {
            LOGGER.log(Level.SEVERE, "Startup failed: cannot read alert history " + snapshotFile.path(), e);
            return EXIT_STARTUP_FAILED;
        }

        BroadcastHub hub = new BroadcastHub(store, config.subscriberQueueCapacity(), eventBus, clock);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock, hub::subscriberCount, store::size);

        CapcodeRegistry capcodes;
        try {
            capcodes = CapcodeRegistry.load(Path.of(config.capcodeFile()), eventBus, clock);
        } catch (CapcodeLoadException e) {
            LOGGER.log(Level.SEVERE, "Startup failed: " + e.getMessage(), e);
            return EXIT_STARTUP_FAILED;
        }

        SnapshotFlusher flusher = new SnapshotFlusher(store, snapshotFile, eventBus, clock);
        MaintenanceScheduler scheduler = new MaintenanceScheduler(
                store,
                flusher,
                clock,
                config.flushInterval(),
                config.evictionInterval()
        );
        ApiServer apiServer = new ApiServer(
                config.httpPort(),
                store,
                new AlertStreamHandler(hub, config.keepAliveInterval(), config.snapshotLimit()),
                capcodes,
                diagnosticsTracker
        );
        IngestionLoop ingestion = new IngestionLoop(
                new LineParser(config.decoderZone()),
                capcodes,
                store,
                hub,
                eventBus,
                clock
        );

        DecoderSource source;
        InputStream decoderOutput;
        try {
            source = DecoderSources.fromConfig(config.decoder());
            decoderOutput = source.open();
        } catch (IOException | IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Startup failed: cannot open decoder stream", e);
            return EXIT_STARTUP_FAILED;
        }

        try {
            apiServer.start();
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Startup failed: " + e.getMessage(), e);
            source.close();
            return EXIT_STARTUP_FAILED;
        }
        scheduler.start();
        LOGGER.info("Ingesting from " + source.describe());

        AtomicBoolean stopped = new AtomicBoolean();
        Runnable shutdown = () -> {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
            ingestion.stop();
            apiServer.stop();
            scheduler.shutdown();
            source.close();
        };
        Thread shutdownHook = new Thread(shutdown, "pager-watch-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            ingestion.run(decoderOutput);
            return EXIT_OK;
        } catch (IngestionLostException e) {
            LOGGER.log(Level.SEVERE, "Ingestion lost: " + e.getMessage(), e);
            shutdown.run();
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
            return EXIT_INGESTION_LOST;
        }
    }

    static RuntimeFlags resolveRuntimeFlags(String[] args, Map<String, String> env, Consumer<String> warn) {
        boolean verbose = Arrays.stream(args).anyMatch(arg -> "-v".equals(arg) || "--verbose".equals(arg));
        for (String arg : args) {
            if (!"-v".equals(arg) && !"--verbose".equals(arg)) {
                warn.accept("Ignoring unknown argument " + arg);
            }
        }

        String verboseRaw = env.getOrDefault("PAGER_VERBOSE", "false");
        if ("true".equalsIgnoreCase(verboseRaw)) {
            verbose = true;
        } else if (!"false".equalsIgnoreCase(verboseRaw)) {
            warn.accept("Unknown PAGER_VERBOSE=" + verboseRaw + ", defaulting to false");
        }

        Path configDir = Path.of(env.getOrDefault("PAGER_CONFIG_DIR", "config"));

        Integer httpPort = null;
        String portRaw = env.get("PAGER_HTTP_PORT");
        if (portRaw != null && !portRaw.isBlank()) {
            try {
                int parsed = Integer.parseInt(portRaw.trim());
                if (parsed < 0 || parsed > 65_535) {
                    warn.accept("PAGER_HTTP_PORT=" + portRaw + " is out of range, using configured port");
                } else {
                    httpPort = parsed;
                }
            } catch (NumberFormatException e) {
                warn.accept("Unknown PAGER_HTTP_PORT=" + portRaw + ", using configured port");
            }
        }

        return new RuntimeFlags(verbose, configDir, httpPort);
    }

    record RuntimeFlags(boolean verbose, Path configDir, Integer httpPort) {
    }
}
