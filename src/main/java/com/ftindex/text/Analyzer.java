package com.ftindex.text;

import java.util.List;

public interface Analyzer {

    /**
     * 将文本切分为按位置递增的词项序列。相同输入必须得到相同输出。
     *
     * @throws AnalyzerException 文本无法分词时抛出
     */
    List<Token> tokenize(String text);
}
