package com.pagerwatch.pipeline.capcode;

import com.pagerwatch.core.bus.EventBus;
import com.pagerwatch.core.events.CapcodesReloaded;
import com.pagerwatch.core.model.CapcodeRecord;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/**
 * Process-wide holder of the current {@link CapcodeTable}. Readers take one snapshot per message
 * and never observe a partially loaded table; reloads are serialized.
 */
public class CapcodeRegistry {
    private final Path source;
    private final Function<Path, CapcodeTable> loader;
    private final EventBus eventBus;
    private final Clock clock;
    private final Object reloadLock = new Object();
    private volatile CapcodeTable current;

    public CapcodeRegistry(Path source, EventBus eventBus, Clock clock) {
        this(source, CapcodeFileReader::load, eventBus, clock);
    }

    CapcodeRegistry(Path source, Function<Path, CapcodeTable> loader, EventBus eventBus, Clock clock) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.loader = loader;
        this.eventBus = eventBus;
        this.clock = clock;
        this.current = CapcodeTable.empty();
    }

    /**
     * Loads the table at startup. A {@link com.pagerwatch.core.error.CapcodeLoadException} propagates to the caller.
     */
    public static CapcodeRegistry load(Path source, EventBus eventBus, Clock clock) {
        CapcodeRegistry registry = new CapcodeRegistry(source, eventBus, clock);
        registry.reload();
        return registry;
    }

    public CapcodeTable reload() {
        synchronized (reloadLock) {
            CapcodeTable loaded = loader.apply(source);
            current = loaded;
            eventBus.publish(new CapcodesReloaded(clock.instant(), source.toString(), loaded.size(), loaded.skippedRows()));
            return loaded;
        }
    }

    public CapcodeTable current() {
        return current;
    }

    public CapcodeRecord lookup(String capcode) {
        return current.lookup(capcode);
    }

    public Path source() {
        return source;
    }
}
