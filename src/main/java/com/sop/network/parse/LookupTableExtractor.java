package com.sop.network.parse;

import com.sop.network.core.model.LookupEntry;
import com.sop.network.core.model.LookupTable;
import com.sop.network.extract.DefaultEntityPatterns;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Captures pipe-delimited tables (clinic and provider directories) as typed lookup tables.
 * The revision-history table is left to {@link Recognizers#revisionEntries(String)}.
 */
public class LookupTableExtractor {

    private static final Pattern TIN_CELL = Pattern.compile("^(?:TIN:?\\s*)?(\\d{3}-?\\d{2}-?\\d{4})$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NPI_CELL = Pattern.compile("^(?:NPI:?\\s*)?(\\d{10})$", Pattern.CASE_INSENSITIVE);
    private static final int CAPTION_LOOKBACK = 5;

    private final Pattern providerIdPattern;

    public LookupTableExtractor() {
        this(DefaultEntityPatterns.providerId().getPattern());
    }

    public LookupTableExtractor(Pattern providerIdPattern) {
        this.providerIdPattern = providerIdPattern;
    }

    public List<LookupTable> extract(String text) {
        List<LookupTable> tables = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tables;
        }
        String[] lines = text.split("\n", -1);
        Set<String> usedNames = new HashSet<>();
        int i = 0;
        while (i < lines.length) {
            if (!Recognizers.isTableLine(lines[i])) {
                i++;
                continue;
            }
            int start = i;
            List<List<String>> rows = new ArrayList<>();
            boolean revisionTable = false;
            while (i < lines.length && Recognizers.isTableLine(lines[i])) {
                revisionTable |= Recognizers.isRevisionRow(lines[i]);
                Recognizers.tableRow(lines[i]).ifPresent(rows::add);
                i++;
            }
            if (revisionTable || rows.size() < 2) {
                continue;
            }
            String name = uniqueName(captionFor(lines, start)
                    .orElse("table_" + (tables.size() + 1)), usedNames);
            tables.add(toTable(name, rows));
        }
        return tables;
    }

    private LookupTable toTable(String name, List<List<String>> rows) {
        List<String> header = rows.get(0);
        List<String> columns = new ArrayList<>();
        for (int c = 0; c < header.size(); c++) {
            String cell = header.get(c);
            columns.add(cell.isEmpty() ? "column_" + (c + 1) : cell);
        }
        List<LookupEntry> entries = new ArrayList<>();
        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.stream().allMatch(String::isEmpty)) {
                continue;
            }
            entries.add(toEntry(columns, row));
        }
        return new LookupTable(name, columns, entries);
    }

    private LookupEntry toEntry(List<String> columns, List<String> row) {
        Map<String, String> cells = new LinkedHashMap<>();
        String tin = null;
        String npi = null;
        String providerId = null;
        for (int c = 0; c < row.size(); c++) {
            String cell = row.get(c);
            String column = c < columns.size() ? columns.get(c) : "column_" + (c + 1);
            cells.putIfAbsent(column, cell);
            if (c == 0) {
                continue;
            }
            Matcher tinMatcher = TIN_CELL.matcher(cell);
            Matcher npiMatcher = NPI_CELL.matcher(cell);
            if (tin == null && tinMatcher.matches()) {
                tin = tinMatcher.group(1).replace("-", "");
            } else if (npi == null && npiMatcher.matches()) {
                npi = npiMatcher.group(1);
            } else if (providerId == null) {
                Matcher idMatcher = providerIdPattern.matcher(cell);
                if (idMatcher.find()) {
                    providerId = idMatcher.group();
                }
            }
        }
        String name = row.isEmpty() ? "" : row.get(0);
        return new LookupEntry(name, tin, providerId, npi, locationOf(name), cells);
    }

    /**
     * Trailing word of a multi-word name: {@code Care Medical Idaho -> Idaho}.
     */
    static String locationOf(String name) {
        String[] words = name.trim().split("\\s+");
        return words.length > 1 ? words[words.length - 1] : null;
    }

    private Optional<String> captionFor(String[] lines, int tableStart) {
        int seen = 0;
        for (int j = tableStart - 1; j >= 0 && seen < CAPTION_LOOKBACK; j--) {
            String line = lines[j];
            if (line.isBlank()) {
                continue;
            }
            if (Recognizers.isTableLine(line)) {
                return Optional.empty();
            }
            seen++;
            Optional<String> caption = Recognizers.caption(line).map(LookupTableExtractor::slug)
                    .filter(s -> !s.isEmpty());
            if (caption.isPresent()) {
                return caption;
            }
        }
        return Optional.empty();
    }

    static String slug(String text) {
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }

    private static String uniqueName(String base, Set<String> used) {
        String name = base;
        int n = 2;
        while (!used.add(name)) {
            name = base + "_" + n++;
        }
        return name;
    }
}
