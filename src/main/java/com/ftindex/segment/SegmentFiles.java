package com.ftindex.segment;

import com.ftindex.config.Constants;

import java.nio.file.Path;

/**
 * 段目录内各文件的命名：{@code <name>.dic}、{@code <name>.pst}、{@code <name>.len}、{@code <name>.meta.json}。
 */
public final class SegmentFiles {
    private SegmentFiles() {
    }

    public static Path dictionary(Path directory, String segmentName) {
        return directory.resolve(segmentName + Constants.DICT_SUFFIX);
    }

    public static Path postings(Path directory, String segmentName) {
        return directory.resolve(segmentName + Constants.POSTINGS_SUFFIX);
    }

    public static Path lengths(Path directory, String segmentName) {
        return directory.resolve(segmentName + Constants.LENGTH_SUFFIX);
    }

    public static Path meta(Path directory, String segmentName) {
        return directory.resolve(segmentName + Constants.META_SUFFIX);
    }
}
