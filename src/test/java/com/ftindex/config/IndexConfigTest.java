package com.ftindex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        IndexConfig config = IndexConfig.defaults();

        assertEquals(Constants.DEFAULT_ANALYZER, config.getAnalyzer());
        assertEquals(Constants.DEFAULT_PARTITIONS, config.getPartitions());
        assertEquals(Constants.SKIP_INTERVAL, config.getSkipInterval());
        assertEquals(Constants.BYTE_SLICE_BLOCK_SIZE, config.getByteSliceBlockSize());
        assertEquals(Constants.BYTE_SLICE_MAX_BLOCKS, config.getByteSliceMaxBlocks());
        assertEquals(Constants.BUFFER_BLOCK_SIZE, config.getBufferBlockSize());
        assertEquals(Constants.BUFFER_MAX_BLOCKS, config.getBufferMaxBlocks());
        assertTrue(Constants.DEFAULT_PARTITIONS <= Constants.MAX_PARTITIONS);
        config.validate();
    }

    @Test
    void testSetters() {
        IndexConfig config = new IndexConfig();
        config.setAnalyzer("english");
        config.setPartitions(3);
        config.setSkipInterval(16);
        config.setByteSliceBlockSize(64);
        config.setByteSliceMaxBlocks(100);
        config.setBufferBlockSize(128);
        config.setBufferMaxBlocks(200);

        assertEquals("english", config.getAnalyzer());
        assertEquals(3, config.getPartitions());
        assertEquals(16, config.getSkipInterval());
        assertEquals(64, config.getByteSliceBlockSize());
        assertEquals(100, config.getByteSliceMaxBlocks());
        assertEquals(128, config.getBufferBlockSize());
        assertEquals(200, config.getBufferMaxBlocks());
    }

    @Test
    void testValidateRejectsOutOfRangeValues() {
        IndexConfig tooManyPartitions = IndexConfig.defaults();
        tooManyPartitions.setPartitions(Constants.MAX_PARTITIONS + 1);
        assertThrows(IllegalArgumentException.class, tooManyPartitions::validate);

        IndexConfig zeroSkip = IndexConfig.defaults();
        zeroSkip.setSkipInterval(0);
        assertThrows(IllegalArgumentException.class, zeroSkip::validate);

        IndexConfig blankAnalyzer = IndexConfig.defaults();
        blankAnalyzer.setAnalyzer(" ");
        assertThrows(IllegalArgumentException.class, blankAnalyzer::validate);
    }

    @Test
    void testLoadKeepsDefaultsForMissingFields() throws IOException {
        Path file = tempDir.resolve("index.json");
        Files.writeString(file, "{\"partitions\": 2, \"skipInterval\": 8, \"unknownField\": true}");

        IndexConfig config = IndexConfig.load(file);

        assertEquals(2, config.getPartitions());
        assertEquals(8, config.getSkipInterval());
        assertEquals(Constants.DEFAULT_ANALYZER, config.getAnalyzer());
    }

    @Test
    void testLoadWrapsParseFailureWithPath() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");

        IOException exception = assertThrows(IOException.class, () -> IndexConfig.load(file));
        assertTrue(exception.getMessage().contains("broken.json"));
    }
}
