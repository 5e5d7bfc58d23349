package com.ftindex.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按字母数字连续片段切词并转小写，可选过滤停用词。被过滤的词不占位置。
 */
public class StandardAnalyzer implements Analyzer {

    private static final Pattern WORD_PATTERN = Pattern.compile("[\\p{L}\\p{N}]+");

    private final boolean enableStopWords;
    private final int maxTokenLength;

    public StandardAnalyzer() {
        this(false, 255);
    }

    /**
     * @param enableStopWords 是否过滤英文停用词
     * @param maxTokenLength 超过该长度的片段视为异常输入
     */
    public StandardAnalyzer(boolean enableStopWords, int maxTokenLength) {
        if (maxTokenLength <= 0) {
            throw new IllegalArgumentException("maxTokenLength 必须为正数: " + maxTokenLength);
        }
        this.enableStopWords = enableStopWords;
        this.maxTokenLength = maxTokenLength;
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        Matcher matcher = WORD_PATTERN.matcher(text);
        int nextPosition = 0;
        while (matcher.find()) {
            if (matcher.end() - matcher.start() > maxTokenLength) {
                throw new AnalyzerException("词项过长: offset=" + matcher.start()
                    + ", length=" + (matcher.end() - matcher.start()) + ", max=" + maxTokenLength);
            }
            String term = matcher.group().toLowerCase(Locale.ROOT);
            if (enableStopWords && StopWords.isStopWord(term)) {
                continue;
            }
            tokens.add(new Token(term, nextPosition++));
        }
        return List.copyOf(tokens);
    }
}
