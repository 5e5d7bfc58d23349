package com.ftindex.posting;

/**
 * 倒排格式选项，决定文档流是否记录词频、是否有位置流、词项摘要是否携带 payload。
 *
 * @param flags 选项位组合
 */
public record PostingFormatOption(int flags) {
    public static final int HAS_TERM_FREQ = 1;
    public static final int HAS_POSITION = 1 << 1;
    public static final int HAS_TERM_PAYLOAD = 1 << 2;
    public static final int OPTION_FLAG_ALL = HAS_TERM_FREQ | HAS_POSITION | HAS_TERM_PAYLOAD;

    public static final PostingFormatOption ALL = new PostingFormatOption(OPTION_FLAG_ALL);

    public PostingFormatOption {
        if ((flags & ~OPTION_FLAG_ALL) != 0) {
            throw new IllegalArgumentException("未知的倒排格式选项: " + Integer.toBinaryString(flags));
        }
        if ((flags & HAS_POSITION) != 0 && (flags & HAS_TERM_FREQ) == 0) {
            throw new IllegalArgumentException("记录位置必须同时记录词频");
        }
    }

    public boolean hasTermFrequency() {
        return (flags & HAS_TERM_FREQ) != 0;
    }

    public boolean hasPosition() {
        return (flags & HAS_POSITION) != 0;
    }

    public boolean hasTermPayload() {
        return (flags & HAS_TERM_PAYLOAD) != 0;
    }
}
