package com.ftindex.text;

/**
 * 分词结果：归一化后的词项及其在文档中的位置序号。
 */
public record Token(String term, int position) {
}
