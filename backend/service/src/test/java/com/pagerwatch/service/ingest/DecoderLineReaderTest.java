package com.pagerwatch.service.ingest;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DecoderLineReaderTest {
    @Test
    void linesSplitAcrossReadsAreReassembled() throws Exception {
        InputStream trickle = new TrickleInputStream("FLEX|a|b\nFLEX|c|d\n".getBytes(StandardCharsets.UTF_8), 3);

        assertEquals(List.of("FLEX|a|b", "FLEX|c|d"), readAll(new DecoderLineReader(trickle)));
    }

    @Test
    void unterminatedTrailingFragmentIsDiscarded() throws Exception {
        DecoderLineReader reader = new DecoderLineReader(stream("complete line\nFLEX|2026-03-01 11:0"));

        assertEquals(List.of("complete line"), readAll(reader));
        assertEquals(1, reader.discardedFragments());
    }

    @Test
    void runawayLineWithoutTerminatorIsSkippedWithBoundedBuffer() throws Exception {
        String runaway = "x".repeat(DecoderLineReader.MAX_LINE_BYTES * 3);
        String longest = "y".repeat(DecoderLineReader.MAX_LINE_BYTES);
        DecoderLineReader reader = new DecoderLineReader(stream("before\n" + runaway + "\n" + longest + "\nafter\n"));

        List<String> lines = readAll(reader);

        assertEquals(List.of("before", longest, "after"), lines);
        assertEquals(1, reader.oversizedLines());
        assertEquals(0, reader.discardedFragments());
    }

    @Test
    void carriageReturnsAreStripped() throws Exception {
        DecoderLineReader reader = new DecoderLineReader(stream("first\r\nsecond\n"));

        assertEquals(List.of("first", "second"), readAll(reader));
    }

    @Test
    void invalidUtf8BytesAreDroppedNotFatal() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("Brand ".getBytes(StandardCharsets.UTF_8));
        bytes.write(new byte[]{(byte) 0xC3, (byte) 0x28});
        bytes.write(" Zaandam\nStraße\n".getBytes(StandardCharsets.UTF_8));

        List<String> lines = readAll(new DecoderLineReader(new ByteArrayInputStream(bytes.toByteArray())));

        assertEquals(2, lines.size());
        assertEquals("Brand ( Zaandam", lines.get(0));
        assertEquals("Straße", lines.get(1));
    }

    @Test
    void emptyLinesAreReturnedForTheParserToReject() throws Exception {
        assertEquals(List.of("", "x"), readAll(new DecoderLineReader(stream("\nx\n"))));
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> readAll(DecoderLineReader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        Optional<String> line;
        while ((line = reader.readLine()).isPresent()) {
            lines.add(line.get());
        }
        return lines;
    }

    private static final class TrickleInputStream extends InputStream {
        private final byte[] data;
        private final int step;
        private int pos;

        private TrickleInputStream(byte[] data, int step) {
            this.data = data;
            this.step = step;
        }

        @Override
        public int read() {
            return pos < data.length ? data[pos++] & 0xFF : -1;
        }

        @Override
        public int read(byte[] b, int off, int len) {
            if (pos >= data.length) {
                return -1;
            }
            int n = Math.min(Math.min(len, step), data.length - pos);
            System.arraycopy(data, pos, b, off, n);
            pos += n;
            return n;
        }
    }
}
