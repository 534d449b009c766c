package com.pagerwatch.service.ingest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Splits a decoder byte stream into complete lines. Bytes are buffered until a {@code \n} arrives;
 * a trailing fragment without terminator at end of stream is discarded, never returned.
 * Invalid UTF-8 sequences are dropped. A line longer than {@link #MAX_LINE_BYTES} is skipped up
 * to its terminator and counted as an oversized line.
 */
public class DecoderLineReader {
    private static final Logger LOGGER = Logger.getLogger(DecoderLineReader.class.getName());
    private static final int READ_CHUNK = 4096;
    static final int MAX_LINE_BYTES = 64 * 1024;

    private final InputStream in;
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final byte[] chunk = new byte[READ_CHUNK];
    private int chunkPos;
    private int chunkLen;
    private long discardedFragments;
    private long oversizedLines;
    private long overflowBytes;

    public DecoderLineReader(InputStream in) {
        this.in = in;
    }

    /**
     * Next complete line without its terminator, or empty at end of stream.
     */
    public Optional<String> readLine() throws IOException {
        while (true) {
            while (chunkPos < chunkLen) {
                byte b = chunk[chunkPos++];
                if (b == '\n') {
                    if (overflowBytes > 0) {
                        skipOversized();
                        continue;
                    }
                    return Optional.of(decodePending());
                }
                if (overflowBytes > 0 || pending.size() >= MAX_LINE_BYTES) {
                    overflowBytes++;
                } else {
                    pending.write(b);
                }
            }
            chunkLen = in.read(chunk);
            chunkPos = 0;
            if (chunkLen < 0) {
                chunkLen = 0;
                if (pending.size() > 0 || overflowBytes > 0) {
                    discardedFragments++;
                    overflowBytes = 0;
                    LOGGER.warning("Discarding " + pending.size() + " bytes of unterminated decoder output at end of stream");
                    pending.reset();
                }
                return Optional.empty();
            }
        }
    }

    public long discardedFragments() {
        return discardedFragments;
    }

    public long oversizedLines() {
        return oversizedLines;
    }

    private void skipOversized() {
        oversizedLines++;
        long length = pending.size() + overflowBytes;
        LOGGER.warning("Skipping decoder line of " + length + " bytes, longer than " + MAX_LINE_BYTES);
        pending.reset();
        overflowBytes = 0;
    }

    private String decodePending() throws CharacterCodingException {
        byte[] bytes = pending.toByteArray();
        pending.reset();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        decoder.reset();
        return decoder.decode(ByteBuffer.wrap(bytes, 0, length)).toString();
    }
}
