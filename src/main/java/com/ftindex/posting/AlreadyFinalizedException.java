package com.ftindex.posting;

/**
 * 对已封存的倒排结构继续写入。
 */
public class AlreadyFinalizedException extends RuntimeException {
    private final String operation;

    public AlreadyFinalizedException(String operation, String detail) {
        super("已封存，不允许执行 " + operation + ": " + detail);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
