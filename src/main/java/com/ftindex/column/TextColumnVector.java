package com.ftindex.column;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 堆内文本列。
 */
public final class TextColumnVector implements ColumnVector {
    private final List<String> values;

    public TextColumnVector() {
        this.values = new ArrayList<>();
    }

    public TextColumnVector(List<String> values) {
        if (values == null) {
            throw new IllegalArgumentException("values 不能为null");
        }
        this.values = new ArrayList<>(values);
    }

    /**
     * 以文本文件的每一行作为一个值。
     */
    public static TextColumnVector fromLines(Path file) throws IOException {
        return new TextColumnVector(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public TextColumnVector append(String value) {
        values.add(value);
        return this;
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public String getValue(int rowIndex) {
        return values.get(rowIndex);
    }
}
