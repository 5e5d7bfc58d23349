package com.ftindex.invert;

import com.ftindex.posting.PostingWriter;

/**
 * 按词项取得（必要时创建）倒排构建器。倒排器不关心构建器存放在哪里。
 */
@FunctionalInterface
public interface PostingWriterProvider {

    PostingWriter get(String term);
}
