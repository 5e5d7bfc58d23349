package com.ftindex.posting;

/**
 * 在不允许的迭代器状态下调用了 seek 操作。
 */
public class InvalidIteratorStateException extends RuntimeException {
    private final PostingIterator.State state;
    private final String operation;

    public InvalidIteratorStateException(String operation, PostingIterator.State state) {
        super("迭代器状态不允许 " + operation + ": state=" + state);
        this.operation = operation;
        this.state = state;
    }

    public PostingIterator.State getState() {
        return state;
    }

    public String getOperation() {
        return operation;
    }
}
