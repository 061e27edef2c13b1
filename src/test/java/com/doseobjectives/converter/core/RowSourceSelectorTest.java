package com.doseobjectives.converter.core;

import com.doseobjectives.converter.config.ConverterConfig;
import com.doseobjectives.converter.strategy.CsvRowSource;
import com.doseobjectives.converter.strategy.EasyExcelRowSource;
import com.doseobjectives.converter.strategy.PoiEventRowSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RowSourceSelector.
 */
class RowSourceSelectorTest {

    @Test
    void testHintWins(@TempDir Path tempDir) {
        Path csv = tempDir.resolve("plan.csv");

        assertThat(new RowSourceSelector(ConverterConfig.Reader.POI_EVENT, ',').select(csv)).isInstanceOf(PoiEventRowSource.class);
        assertThat(new RowSourceSelector(ConverterConfig.Reader.EASY_EXCEL, ',').select(csv)).isInstanceOf(EasyExcelRowSource.class);
        assertThat(new RowSourceSelector(ConverterConfig.Reader.CSV, ',').select(tempDir.resolve("plan.xlsx")))
                .isInstanceOf(CsvRowSource.class);
    }

    @Test
    void testAutoUsesExtensionAndSize(@TempDir Path tempDir) throws Exception {
        RowSourceSelector selector = new RowSourceSelector(ConverterConfig.Reader.AUTO, ';');
        Path small = Files.createFile(tempDir.resolve("small.xlsx"));
        Path large = tempDir.resolve("large.xlsx");
        try (RandomAccessFile file = new RandomAccessFile(large.toFile(), "rw")) {
            file.setLength(RowSourceSelector.LARGE_FILE_THRESHOLD_BYTES + 1);
        }

        assertThat(selector.select(tempDir.resolve("PLAN.CSV"))).isInstanceOf(CsvRowSource.class);
        assertThat(selector.select(small)).isInstanceOf(EasyExcelRowSource.class);
        assertThat(selector.select(large)).isInstanceOf(PoiEventRowSource.class);
    }

    @Test
    void testNullHintMeansAuto(@TempDir Path tempDir) {
        assertThat(new RowSourceSelector(null, ',').select(tempDir.resolve("plan.csv"))).isInstanceOf(CsvRowSource.class);
    }
}
