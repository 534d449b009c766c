package com.pagerwatch.service.ingest;

import com.pagerwatch.service.config.DecoderConfig;
import com.pagerwatch.service.config.DecoderMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecoderSourcesTest {
    @TempDir
    Path tempDir;

    @Test
    void fileSourceStreamsCaptureContents() throws Exception {
        Path capture = tempDir.resolve("capture.txt");
        Files.writeString(capture, "FLEX|line one\n");
        DecoderSource source = DecoderSources.fromConfig(new DecoderConfig(DecoderMode.FILE, capture.toString(), null));

        try (InputStream in = source.open()) {
            assertEquals(Optional.of("FLEX|line one"), new DecoderLineReader(in).readLine());
        } finally {
            source.close();
        }
        assertTrue(source.describe().contains("capture.txt"));
    }

    @Test
    void missingFileFailsOnOpen() {
        DecoderSource source = DecoderSources.file(tempDir.resolve("absent.txt"));

        assertThrows(IOException.class, source::open);
    }

    @Test
    void fileModeWithoutPathIsAConfigurationError() {
        assertThrows(IllegalStateException.class,
                () -> DecoderSources.fromConfig(new DecoderConfig(DecoderMode.FILE, " ", null)));
    }

    @Test
    void commandSourceReadsProcessOutputUntilExit() throws Exception {
        DecoderSource source = DecoderSources.command("printf 'FLEX|a\\nFLEX|b\\n'");
        try {
            DecoderLineReader reader = new DecoderLineReader(source.open());

            assertEquals(Optional.of("FLEX|a"), reader.readLine());
            assertEquals(Optional.of("FLEX|b"), reader.readLine());
            assertEquals(Optional.empty(), reader.readLine());
        } finally {
            source.close();
        }
    }
}
