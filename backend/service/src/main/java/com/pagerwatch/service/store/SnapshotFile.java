package com.pagerwatch.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagerwatch.core.error.StoreIoException;
import com.pagerwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON history file, replaced as a whole on every write: the document goes to a sibling temp
 * file first and is then renamed over the target, so readers see the old or the new file only.
 */
public class SnapshotFile {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;

    public SnapshotFile(Path file) {
        this.file = file.toAbsolutePath();
    }

    public Path path() {
        return file;
    }

    public Optional<SnapshotDocument> read() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return Optional.of(MAPPER.readValue(in, SnapshotDocument.class));
        } catch (IOException e) {
            throw new StoreIoException("Failed loading alert history from " + file, e);
        }
    }

    public void write(SnapshotDocument document) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writeValue(out, document);
            }
            move(temp);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StoreIoException("Failed writing alert history to " + file, e);
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ignored) {
            // the next successful write overwrites it
        }
    }
}
