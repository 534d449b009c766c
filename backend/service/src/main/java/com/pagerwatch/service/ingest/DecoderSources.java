package com.pagerwatch.service.ingest;

import com.pagerwatch.service.config.DecoderConfig;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Decoder sources for the three supported modes. None of them supervises the decoder: when the
 * stream ends the ingestion loop reports it and the process exits.
 */
public final class DecoderSources {
    private static final Logger LOGGER = Logger.getLogger(DecoderSources.class.getName());

    private DecoderSources() {
    }

    public static DecoderSource fromConfig(DecoderConfig config) {
        return switch (config.mode()) {
            case STDIN -> stdin();
            case FILE -> {
                if (config.path() == null || config.path().isBlank()) {
                    throw new IllegalStateException("decoder.path is required in FILE mode");
                }
                yield file(Path.of(config.path()));
            }
            case COMMAND -> command(config.command());
        };
    }

    public static DecoderSource stdin() {
        return new DecoderSource() {
            @Override
            public InputStream open() {
                // System.in stays open for the JVM's lifetime; closing it is not ours to do.
                return new FilterInputStream(System.in) {
                    @Override
                    public void close() {
                    }
                };
            }

            @Override
            public String describe() {
                return "stdin";
            }

            @Override
            public void close() {
            }
        };
    }

    public static DecoderSource file(Path path) {
        return new DecoderSource() {
            private InputStream stream;

            @Override
            public synchronized InputStream open() throws IOException {
                stream = Files.newInputStream(path);
                return stream;
            }

            @Override
            public String describe() {
                return "file " + path;
            }

            @Override
            public synchronized void close() {
                if (stream == null) {
                    return;
                }
                try {
                    stream.close();
                } catch (IOException e) {
                    LOGGER.fine(() -> "Closing decoder file failed: " + e.getMessage());
                }
            }
        };
    }

    public static DecoderSource command(String command) {
        return new ProcessDecoderSource(command);
    }

    static final class ProcessDecoderSource implements DecoderSource {
        private final String command;
        private Process process;

        ProcessDecoderSource(String command) {
            this.command = command;
        }

        @Override
        public synchronized InputStream open() throws IOException {
            ProcessBuilder builder = new ProcessBuilder("/bin/sh", "-c", command)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .redirectInput(ProcessBuilder.Redirect.PIPE);
            process = builder.start();
            process.getOutputStream().close();
            LOGGER.info("Decoder started (pid " + process.pid() + "): " + command);
            return process.getInputStream();
        }

        @Override
        public String describe() {
            return "command '" + command + "'";
        }

        @Override
        public synchronized void close() {
            if (process == null || !process.isAlive()) {
                return;
            }
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
            try {
                if (!process.waitFor(3, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
