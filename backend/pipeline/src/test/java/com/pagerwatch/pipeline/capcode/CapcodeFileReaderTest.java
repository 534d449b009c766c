package com.pagerwatch.pipeline.capcode;

import com.pagerwatch.core.error.CapcodeLoadException;
import com.pagerwatch.core.model.CapcodeRecord;
import com.pagerwatch.core.model.Priority;
import com.pagerwatch.core.model.Service;
import com.pagerwatch.pipeline.support.FixtureUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapcodeFileReaderTest {
    @Test
    void loadsCommaLayoutAndCountsMalformedRows() {
        CapcodeTable table = CapcodeFileReader.load(FixtureUtils.fixturePath("capcodes/capcodes.csv"));

        assertEquals(5, table.size());
        assertEquals(4, table.skippedRows());

        CapcodeRecord station = table.lookup("012345");
        assertEquals("Fire Station 1", station.alias());
        assertEquals(Service.FIRE, station.service());
        assertEquals(Optional.of(Priority.A1), station.priorityHint());

        assertEquals(Service.TRAUMA_HELI, table.lookup("000923993").service());
        assertEquals(Optional.empty(), table.lookup("1420001").priorityHint());
    }

    @Test
    void loadsRegionalSemicolonLayout() {
        CapcodeTable table = CapcodeFileReader.load(FixtureUtils.fixturePath("capcodes/capcodelijst.csv"));

        assertEquals(4, table.size());
        assertEquals(1, table.skippedRows());
        assertEquals("Ambulance 13-145 (Zaanstreek-Waterland)", table.lookup("0120901").alias());
        assertEquals(Service.AMBULANCE, table.lookup("0120901").service());
        assertEquals(Service.FIRE, table.lookup("1420001").service());
        assertEquals(Service.TRAUMA_HELI, table.lookup("0923993").service());
        assertEquals(Service.POLICE, table.lookup("2029568").service());
    }

    @Test
    void lookupMissReturnsUnknownSentinel() {
        CapcodeTable table = CapcodeTable.of(List.of());

        CapcodeRecord miss = table.lookup("7654321");

        assertTrue(miss.isUnknown());
        assertEquals("7654321", miss.capcode());
        assertEquals(Service.UNKNOWN, miss.service());
    }

    @Test
    void quotedFieldsMayContainDelimiters() {
        assertEquals(List.of("0012345", "Post, Noord", "Fire", ""),
                CapcodeFileReader.split("0012345,\"Post, Noord\",Fire,", ','));
        assertEquals(List.of("a \"quoted\" word"), CapcodeFileReader.split("\"a \"\"quoted\"\" word\"", ','));
    }

    @Test
    void missingFileFailsWithLoadError(@TempDir Path dir) {
        Path missing = dir.resolve("missing.csv");

        CapcodeLoadException ex = assertThrows(CapcodeLoadException.class, () -> CapcodeFileReader.load(missing));

        assertEquals(missing, ex.source());
        assertTrue(ex.getMessage().contains("missing.csv"));
    }
}
