package com.ftindex.column;

/**
 * 列数据的只读随机访问视图，倒排器只把值当文本使用。
 */
public interface ColumnVector {

    /**
     * 行数。
     */
    int size();

    /**
     * 读取指定行的文本值，空值返回 null。
     *
     * @throws IndexOutOfBoundsException 行号越界
     */
    String getValue(int rowIndex);
}
