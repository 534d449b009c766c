package com.pagerwatch.service.ingest;

import com.pagerwatch.core.bus.EventBus;
import com.pagerwatch.core.error.IngestionLostException;
import com.pagerwatch.core.events.AlertIngested;
import com.pagerwatch.core.events.LineRejected;
import com.pagerwatch.core.model.Alert;
import com.pagerwatch.core.model.ParsedMessage;
import com.pagerwatch.pipeline.capcode.CapcodeRegistry;
import com.pagerwatch.pipeline.capcode.CapcodeTable;
import com.pagerwatch.pipeline.classify.Classifier;
import com.pagerwatch.pipeline.parse.LineParser;
import com.pagerwatch.pipeline.parse.ParseResult;
import com.pagerwatch.service.hub.BroadcastHub;
import com.pagerwatch.service.store.AlertStore;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single producer: read line, parse, classify, append, publish, strictly in that order and on
 * one thread. Nothing a line contains can stop the loop; only the end or failure of the decoder
 * stream does, and that is reported as {@link IngestionLostException}.
 */
public class IngestionLoop {
    private static final Logger LOGGER = Logger.getLogger(IngestionLoop.class.getName());
    private static final int MAX_LOGGED_LINE = 200;

    private final LineParser parser;
    private final CapcodeRegistry capcodes;
    private final AlertStore store;
    private final BroadcastHub hub;
    private final EventBus eventBus;
    private final Clock clock;
    private final AtomicLong linesRead = new AtomicLong();
    private final AtomicLong linesRejected = new AtomicLong();
    private final AtomicLong alertsIngested = new AtomicLong();
    private volatile boolean stopping;

    public IngestionLoop(
            LineParser parser,
            CapcodeRegistry capcodes,
            AlertStore store,
            BroadcastHub hub,
            EventBus eventBus,
            Clock clock
    ) {
        this.parser = parser;
        this.capcodes = capcodes;
        this.store = store;
        this.hub = hub;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Consumes the stream until it ends. Returns normally only after {@link #stop()} was called.
     */
    public void run(InputStream decoderOutput) {
        DecoderLineReader reader = new DecoderLineReader(decoderOutput);
        try {
            while (true) {
                Optional<String> line = reader.readLine();
                if (line.isEmpty()) {
                    break;
                }
                processLine(line.get());
            }
        } catch (IOException e) {
            if (stopping) {
                return;
            }
            throw new IngestionLostException("Decoder stream failed after " + linesRead.get() + " lines", linesRead.get(), e);
        }
        if (stopping) {
            return;
        }
        throw new IngestionLostException("Decoder stream ended after " + linesRead.get() + " lines", linesRead.get(), null);
    }

    /**
     * @return number of alerts appended for this line
     */
    int processLine(String line) {
        linesRead.incrementAndGet();
        Instant receivedAt = clock.instant();
        try {
            ParseResult result = parser.parse(line, receivedAt);
            if (!result.success()) {
                reject(line, result.reason(), receivedAt);
                return 0;
            }
            CapcodeTable table = capcodes.current();
            int appended = 0;
            for (ParsedMessage message : result.messages()) {
                Alert alert = store.append(Classifier.classify(message, table));
                int deliveredTo = hub.publish(alert);
                appended++;
                alertsIngested.incrementAndGet();
                eventBus.publish(new AlertIngested(receivedAt, alert.id(), alert.service(), alert.priority(), deliveredTo));
            }
            return appended;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Unexpected failure while ingesting line: " + abbreviate(line), e);
            reject(line, "internal error: " + e.getMessage(), receivedAt);
            return 0;
        }
    }

    public void stop() {
        stopping = true;
    }

    public long linesRead() {
        return linesRead.get();
    }

    public long linesRejected() {
        return linesRejected.get();
    }

    public long alertsIngested() {
        return alertsIngested.get();
    }

    private void reject(String line, String reason, Instant receivedAt) {
        linesRejected.incrementAndGet();
        LOGGER.fine(() -> "Dropping decoder line (" + reason + "): " + abbreviate(line));
        eventBus.publish(new LineRejected(receivedAt, reason, abbreviate(line)));
    }

    private static String abbreviate(String line) {
        return line.length() <= MAX_LOGGED_LINE ? line : line.substring(0, MAX_LOGGED_LINE) + "...";
    }
}
