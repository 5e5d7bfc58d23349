package com.ftindex.invert;

import com.ftindex.config.Constants;
import com.ftindex.memory.PostingArenas;
import com.ftindex.posting.PostingFormatOption;
import com.ftindex.posting.PostingWriter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 堆内 Map 承载的构建器提供者，首次见到词项时在给定内存池上创建构建器。
 */
public final class MapPostingWriterProvider implements PostingWriterProvider {
    private final PostingFormatOption option;
    private final PostingArenas arenas;
    private final int skipInterval;
    private final Map<String, PostingWriter> postings = new HashMap<>();

    public MapPostingWriterProvider(PostingFormatOption option, PostingArenas arenas) {
        this(option, arenas, Constants.SKIP_INTERVAL);
    }

    public MapPostingWriterProvider(PostingFormatOption option, PostingArenas arenas, int skipInterval) {
        if (option == null || arenas == null) {
            throw new IllegalArgumentException("option 与 arenas 不能为null");
        }
        this.option = option;
        this.arenas = arenas;
        this.skipInterval = skipInterval;
    }

    @Override
    public PostingWriter get(String term) {
        return postings.computeIfAbsent(term, key -> new PostingWriter(key, option, arenas, skipInterval));
    }

    /**
     * 已创建的构建器，只读视图。
     */
    public Map<String, PostingWriter> postings() {
        return Collections.unmodifiableMap(postings);
    }

    public PostingArenas arenas() {
        return arenas;
    }
}
