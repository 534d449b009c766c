package com.pagerwatch.pipeline.capcode;

import com.pagerwatch.core.model.CapcodeRecord;
import com.pagerwatch.core.model.Capcodes;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable capcode snapshot keyed by canonical capcode. A miss is normal traffic, not an error.
 */
public final class CapcodeTable {
    private static final CapcodeTable EMPTY = new CapcodeTable(Map.of(), 0, "<empty>");

    private final Map<String, CapcodeRecord> records;
    private final int skippedRows;
    private final String source;

    CapcodeTable(Map<String, CapcodeRecord> records, int skippedRows, String source) {
        this.records = Map.copyOf(records);
        this.skippedRows = skippedRows;
        this.source = source;
    }

    public static CapcodeTable empty() {
        return EMPTY;
    }

    public static CapcodeTable of(Collection<CapcodeRecord> records) {
        Map<String, CapcodeRecord> byCapcode = new LinkedHashMap<>();
        for (CapcodeRecord record : records) {
            Capcodes.normalize(record.capcode()).ifPresent(key -> byCapcode.put(key, record));
        }
        return new CapcodeTable(byCapcode, 0, "<memory>");
    }

    public Optional<CapcodeRecord> find(String capcode) {
        return Capcodes.normalize(capcode).map(records::get);
    }

    public CapcodeRecord lookup(String capcode) {
        return find(capcode).orElseGet(() -> CapcodeRecord.unknown(capcode));
    }

    public int size() {
        return records.size();
    }

    public int skippedRows() {
        return skippedRows;
    }

    public String source() {
        return source;
    }
}
