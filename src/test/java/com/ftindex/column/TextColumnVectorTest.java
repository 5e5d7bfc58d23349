package com.ftindex.column;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TextColumnVectorTest {

    @TempDir
    Path tempDir;

    @Test
    void testAppendAndRead() {
        TextColumnVector column = new TextColumnVector(Arrays.asList("a", null));
        column.append("c");

        assertEquals(3, column.size());
        assertEquals("a", column.getValue(0));
        assertNull(column.getValue(1));
        assertEquals("c", column.getValue(2));
        assertThrows(IndexOutOfBoundsException.class, () -> column.getValue(3));
    }

    @Test
    void testFromLines() throws IOException {
        Path file = tempDir.resolve("docs.txt");
        Files.writeString(file, "first line\nsecond line\n\nfourth\n");

        TextColumnVector column = TextColumnVector.fromLines(file);

        assertEquals(4, column.size());
        assertEquals("second line", column.getValue(1));
        assertEquals("", column.getValue(2));
    }
}
