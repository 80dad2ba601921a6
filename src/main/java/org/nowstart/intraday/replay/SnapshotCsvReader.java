package org.nowstart.intraday.replay;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.intraday.data.dto.BollingerBandsValue;
import org.nowstart.intraday.data.dto.IndicatorSnapshot;
import org.nowstart.intraday.data.dto.MacdValue;

/**
 * Reads precomputed indicator snapshots. Required columns: {@code timestamp, close, ema, rsi}. Optional:
 * {@code obv, portfolio_value, bb_upper, bb_middle, bb_lower, macd, macd_signal, macd_histogram}.
 * Blank cells are read as {@code NaN}.
 */
@Slf4j
public class SnapshotCsvReader {

    private static final List<String> REQUIRED_COLUMNS = List.of("timestamp", "close", "ema", "rsi");

    public List<ReplayRow> read(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot file: " + path, e);
        }
        if (lines.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> header = parseHeader(lines.get(0));
        for (String column : REQUIRED_COLUMNS) {
            if (!header.containsKey(column)) {
                throw new IllegalArgumentException("snapshot file missing column: " + column);
            }
        }

        List<ReplayRow> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            rows.add(parseRow(splitCsvLine(line), header, i + 1));
        }
        log.info("event=snapshots_loaded file={} rows={}", path, rows.size());
        return rows;
    }

    private Map<String, Integer> parseHeader(String line) {
        String[] parts = splitCsvLine(line);
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < parts.length; i++) {
            header.put(parts[i].trim().toLowerCase(Locale.ROOT), i);
        }
        return header;
    }

    private ReplayRow parseRow(String[] parts, Map<String, Integer> header, int lineNumber) {
        try {
            Instant timestamp = Instant.parse(cell(parts, header, "timestamp"));
            double close = number(parts, header, "close");
            double ema = number(parts, header, "ema");
            double rsi = number(parts, header, "rsi");
            double obv = number(parts, header, "obv");

            BollingerBandsValue bands = null;
            if (header.containsKey("bb_upper")) {
                bands = new BollingerBandsValue(
                        number(parts, header, "bb_upper"),
                        number(parts, header, "bb_middle"),
                        number(parts, header, "bb_lower")
                );
            }
            MacdValue macd = null;
            if (header.containsKey("macd")) {
                macd = new MacdValue(
                        number(parts, header, "macd"),
                        number(parts, header, "macd_signal"),
                        number(parts, header, "macd_histogram")
                );
            }

            IndicatorSnapshot snapshot = new IndicatorSnapshot(timestamp, close, ema, rsi, obv, bands, macd);
            return new ReplayRow(snapshot, number(parts, header, "portfolio_value"));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid snapshot row at line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    private String cell(String[] parts, Map<String, Integer> header, String column) {
        Integer index = header.get(column);
        if (index == null || index >= parts.length) {
            return "";
        }
        return parts[index].trim();
    }

    private double number(String[] parts, Map<String, Integer> header, String column) {
        String raw = cell(parts, header, column);
        return raw.isEmpty() ? Double.NaN : Double.parseDouble(raw);
    }

    private String[] splitCsvLine(String line) {
        return line.split(",", -1);
    }
}
