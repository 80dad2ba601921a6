package org.nowstart.intraday.replay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotCsvReaderTest {

    private final SnapshotCsvReader reader = new SnapshotCsvReader();

    @TempDir
    Path tempDir;

    @Test
    void read_parsesFixtureRows() throws Exception {
        Path file = Path.of(SnapshotCsvReaderTest.class.getResource("/replay/snapshots.csv").toURI());

        List<ReplayRow> rows = reader.read(file);

        assertThat(rows).hasSize(7);
        ReplayRow first = rows.get(0);
        assertThat(first.snapshot().timestamp()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(first.snapshot().close()).isEqualTo(100.0);
        assertThat(first.snapshot().ema()).isEqualTo(101.0);
        assertThat(first.snapshot().obv()).isEqualTo(1000.0);
        assertThat(first.snapshot().bollingerBands()).isNull();
        assertThat(first.hasPortfolioValue()).isFalse();
    }

    @Test
    void read_blankCellsBecomeNaNAndOptionalGroupsAreParsed() throws Exception {
        Path file = tempDir.resolve("snapshots.csv");
        Files.write(file, List.of(
                "timestamp,close,ema,rsi,obv,portfolio_value,macd,macd_signal,macd_histogram",
                "2024-03-01T00:00:00Z,100.0,,40.0,,1000.0,0.5,0.4,0.1",
                ""
        ));

        List<ReplayRow> rows = reader.read(file);

        assertThat(rows).hasSize(1);
        ReplayRow row = rows.get(0);
        assertThat(row.snapshot().ema()).isNaN();
        assertThat(row.snapshot().hasObv()).isFalse();
        assertThat(row.portfolioValue()).isEqualTo(1000.0);
        assertThat(row.snapshot().macd().histogram()).isEqualTo(0.1);
    }

    @Test
    void read_rejectsMissingRequiredColumn() throws Exception {
        Path file = tempDir.resolve("snapshots.csv");
        Files.write(file, List.of("timestamp,close,ema", "2024-03-01T00:00:00Z,100.0,99.0"));

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rsi");
    }

    @Test
    void read_reportsLineNumberOfMalformedRow() throws Exception {
        Path file = tempDir.resolve("snapshots.csv");
        Files.write(file, List.of("timestamp,close,ema,rsi", "not-a-time,100.0,99.0,40.0"));

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("line 2");
    }

    @Test
    void read_emptyFileYieldsNoRows() throws Exception {
        Path file = Files.createFile(tempDir.resolve("empty.csv"));

        assertThat(reader.read(file)).isEmpty();
    }
}
