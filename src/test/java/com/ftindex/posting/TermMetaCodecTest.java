package com.ftindex.posting;

import com.ftindex.storage.IndexFileReader;
import com.ftindex.storage.IndexFileWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TermMetaCodecTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("全格式下 TermMeta 原样读回")
    void dumpAndLoadWithAllOptions() throws IOException {
        Path file = tempDir.resolve("term_meta");
        TermMeta termMeta = new TermMeta(1, 2, 3);
        TermMetaDumper dumper = new TermMetaDumper(PostingFormatOption.ALL);

        try (IndexFileWriter writer = new IndexFileWriter(file)) {
            dumper.dump(writer, termMeta);
        }
        assertEquals(dumper.recordSize(), Files.size(file));

        try (IndexFileReader reader = new IndexFileReader(file)) {
            TermMetaLoader loader = new TermMetaLoader(PostingFormatOption.ALL);
            assertEquals(termMeta, loader.load(reader));
        }
    }

    @Test
    void optionalFieldsFollowFormat() throws IOException {
        Path file = tempDir.resolve("term_meta_partial");
        PostingFormatOption frequencyOnly = new PostingFormatOption(PostingFormatOption.HAS_TERM_FREQ);
        PostingFormatOption docsOnly = new PostingFormatOption(0);

        try (IndexFileWriter writer = new IndexFileWriter(file)) {
            new TermMetaDumper(frequencyOnly).dump(writer, new TermMeta(4, 9, 7));
            new TermMetaDumper(docsOnly).dump(writer, new TermMeta(5, 5, 0));
        }

        assertEquals(Integer.BYTES + Long.BYTES + Integer.BYTES, Files.size(file));
        try (IndexFileReader reader = new IndexFileReader(file)) {
            assertEquals(new TermMeta(4, 9, 0), new TermMetaLoader(frequencyOnly).load(reader));
            assertEquals(new TermMeta(5, 5, 0), new TermMetaLoader(docsOnly).load(reader));
        }
    }

    @Test
    void corruptRecordIsReported() throws IOException {
        Path file = tempDir.resolve("corrupt");
        try (IndexFileWriter writer = new IndexFileWriter(file)) {
            writer.writeInt(10);
            writer.writeLong(2L);
            writer.writeInt(0);
        }

        try (IndexFileReader reader = new IndexFileReader(file)) {
            assertThrows(IOException.class, () -> new TermMetaLoader(PostingFormatOption.ALL).load(reader));
        }
    }

    @Test
    void invalidTermMetaIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TermMeta(3, 2, 0));
        assertThrows(IllegalArgumentException.class, () -> new TermMeta(-1, 2, 0));
        assertEquals(new TermMeta(0, 0, 0), TermMeta.empty());
    }
}
