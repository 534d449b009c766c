package com.pagerwatch.service;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @Test
    void defaultsWithoutArgsOrEnvironment() {
        List<String> warnings = new ArrayList<>();

        Main.RuntimeFlags flags = Main.resolveRuntimeFlags(new String[0], Map.of(), warnings::add);

        assertFalse(flags.verbose());
        assertEquals(Path.of("config"), flags.configDir());
        assertNull(flags.httpPort());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void verboseFromFlagOrEnvironment() {
        assertTrue(Main.resolveRuntimeFlags(new String[]{"-v"}, Map.of(), message -> {
        }).verbose());
        assertTrue(Main.resolveRuntimeFlags(new String[]{"--verbose"}, Map.of(), message -> {
        }).verbose());
        assertTrue(Main.resolveRuntimeFlags(new String[0], Map.of("PAGER_VERBOSE", "TRUE"), message -> {
        }).verbose());
    }

    @Test
    void environmentOverridesConfigDirAndPort() {
        Main.RuntimeFlags flags = Main.resolveRuntimeFlags(
                new String[0],
                Map.of("PAGER_CONFIG_DIR", "/etc/pager-watch", "PAGER_HTTP_PORT", "9090"),
                message -> {
                }
        );

        assertEquals(Path.of("/etc/pager-watch"), flags.configDir());
        assertEquals(9090, flags.httpPort());
    }

    @Test
    void invalidValuesWarnAndFallBack() {
        List<String> warnings = new ArrayList<>();

        Main.RuntimeFlags flags = Main.resolveRuntimeFlags(
                new String[]{"--colour"},
                Map.of("PAGER_VERBOSE", "loud", "PAGER_HTTP_PORT", "eighty"),
                warnings::add
        );

        assertFalse(flags.verbose());
        assertNull(flags.httpPort());
        assertEquals(3, warnings.size());
    }

    @Test
    void missingCapcodeFileIsAStartupFailure() throws Exception {
        Path dir = Files.createTempDirectory("main-startup-");
        Files.writeString(dir.resolve("monitor.json"), """
                {"capcodeFile": "%s", "historyFile": "%s"}
                """.formatted(dir.resolve("absent.csv"), dir.resolve("history.json")));

        int exitCode = Main.run(new Main.RuntimeFlags(false, dir, 0));

        assertEquals(Main.EXIT_STARTUP_FAILED, exitCode);
    }

    @Test
    void missingConfigIsAStartupFailure() throws Exception {
        Path dir = Files.createTempDirectory("main-noconfig-");

        assertEquals(Main.EXIT_STARTUP_FAILED, Main.run(new Main.RuntimeFlags(false, dir, 0)));
    }

    @Test
    void endOfDecoderStreamEndsWithIngestionLost() throws Exception {
        Path dir = Files.createTempDirectory("main-ingest-");
        Path capcodes = dir.resolve("capcodes.csv");
        Path capture = dir.resolve("capture.txt");
        Path history = dir.resolve("state/history.json");
        Files.writeString(capcodes, "1420001,Post Middenbeemster,Brandweer\n");
        Files.writeString(capture, "FLEX|2026-03-01 11:02:03|1600/2/K/A|08.120|001420001|ALN|A1 Brand Rijperweg\n");
        Files.writeString(dir.resolve("monitor.json"), """
                {"capcodeFile": "%s", "historyFile": "%s", "decoder": {"mode": "FILE", "path": "%s"}}
                """.formatted(capcodes, history, capture));

        int exitCode = Main.run(new Main.RuntimeFlags(false, dir, 0));

        assertEquals(Main.EXIT_INGESTION_LOST, exitCode);
        assertTrue(Files.readString(history).contains("A1 Brand Rijperweg"));
    }
}
