package com.pagerwatch.pipeline.capcode;

import com.pagerwatch.core.error.CapcodeLoadException;
import com.pagerwatch.core.model.CapcodeRecord;
import com.pagerwatch.core.model.Capcodes;
import com.pagerwatch.core.model.Priority;
import com.pagerwatch.core.model.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads capcode lists in either of two layouts:
 * <ul>
 *     <li>{@code capcode,alias,service[,priority]} (comma or semicolon separated)</li>
 *     <li>{@code capcode;dienst;provincie;regio;eenheid}, the layout of the public Dutch P2000 lists</li>
 * </ul>
 * Fields may be double-quoted. Blank lines and {@code #} comments are ignored; rows that cannot be
 * interpreted are skipped and counted.
 */
public final class CapcodeFileReader {
    private static final Logger LOGGER = Logger.getLogger(CapcodeFileReader.class.getName());
    private static final int REGIONAL_COLUMNS = 5;

    private CapcodeFileReader() {
    }

    public static CapcodeTable load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CapcodeLoadException(path, "Capcode file not found: " + path, null);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CapcodeLoadException(path, "Failed reading capcode file " + path, e);
        }
        CapcodeTable table = parse(lines, path.toString());
        LOGGER.info("Loaded " + table.size() + " capcodes from " + path + " (" + table.skippedRows() + " rows skipped)");
        return table;
    }

    static CapcodeTable parse(List<String> lines, String source) {
        Map<String, CapcodeRecord> records = new LinkedHashMap<>();
        int skipped = 0;
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String trimmed = stripBom(line).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Optional<CapcodeRecord> record = parseRow(trimmed);
            if (record.isEmpty()) {
                skipped++;
                LOGGER.log(Level.FINE, "Skipping malformed capcode row {0} in {1}", new Object[]{lineNumber, source});
                continue;
            }
            records.put(record.get().capcode(), record.get());
        }
        return new CapcodeTable(records, skipped, source);
    }

    static Optional<CapcodeRecord> parseRow(String row) {
        char delimiter = row.indexOf(';') >= 0 ? ';' : ',';
        List<String> columns = split(row, delimiter);
        if (columns.size() < 3) {
            return Optional.empty();
        }
        Optional<String> capcode = Capcodes.normalize(columns.get(0));
        if (capcode.isEmpty()) {
            return Optional.empty();
        }
        if (delimiter == ';' && columns.size() >= REGIONAL_COLUMNS) {
            return Optional.of(regionalRecord(capcode.get(), columns));
        }

        String alias = columns.get(1);
        if (alias.isEmpty()) {
            return Optional.empty();
        }
        Optional<Priority> priorityHint = Optional.empty();
        if (columns.size() > 3 && !columns.get(3).isEmpty()) {
            priorityHint = Priority.fromToken(columns.get(3));
            if (priorityHint.isEmpty()) {
                return Optional.empty();
            }
        }
        return Optional.of(new CapcodeRecord(capcode.get(), alias, Service.fromTag(columns.get(2)), priorityHint));
    }

    private static CapcodeRecord regionalRecord(String capcode, List<String> columns) {
        String discipline = columns.get(1);
        String region = columns.get(3);
        String unit = columns.get(4);

        Service service = Service.fromTag(unit);
        if (service != Service.TRAUMA_HELI) {
            service = Service.fromTag(discipline);
        }
        String alias = unit.isEmpty() ? discipline : unit;
        if (!region.isEmpty()) {
            alias = alias + " (" + region + ")";
        }
        return new CapcodeRecord(capcode, alias, service, Optional.empty());
    }

    static List<String> split(String row, char delimiter) {
        List<String> columns = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < row.length(); i++) {
            char c = row.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < row.length() && row.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == delimiter && !quoted) {
                columns.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        columns.add(current.toString().trim());
        return columns;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
