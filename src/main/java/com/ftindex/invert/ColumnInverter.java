package com.ftindex.invert;

import com.ftindex.column.ColumnVector;
import com.ftindex.posting.AlreadyFinalizedException;
import com.ftindex.posting.OutOfOrderDocumentException;
import com.ftindex.posting.PostingWriter;
import com.ftindex.text.Analyzer;
import com.ftindex.text.AnalyzerException;
import com.ftindex.text.AnalyzerRegistry;
import com.ftindex.text.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 列倒排器：把一列文本的一个行区间转成 词项 -&gt; 倒排 映射，并记录每个文档的词元数。
 *
 * <p>生命周期：多次 {@link #invertColumn} / {@link #merge}，然后 {@link #sort()}，
 * 最后 {@link #generatePosting()} 封存全部倒排。封存后实例只读。
 * 单个实例只在一个线程内使用；跨分区并行时每个分区持有自己的实例，最后在一个线程上合并。
 */
public final class ColumnInverter {
    private static final Logger logger = LoggerFactory.getLogger(ColumnInverter.class);

    private final Analyzer analyzer;
    private final PostingWriterProvider provider;
    private final Map<String, PostingWriter> postings = new HashMap<>();

    private int[] termCounts = new int[16];
    private int docCount;
    private int firstDocId = -1;
    private List<Map.Entry<String, PostingWriter>> sortedTerms;
    private boolean generated;
    private boolean consumed;

    public ColumnInverter(Analyzer analyzer, PostingWriterProvider provider) {
        if (analyzer == null || provider == null) {
            throw new IllegalArgumentException("analyzer 与 provider 不能为null");
        }
        this.analyzer = analyzer;
        this.provider = provider;
    }

    public ColumnInverter(String analyzerName, PostingWriterProvider provider) {
        this(AnalyzerRegistry.create(analyzerName), provider);
    }

    /**
     * 对 [startRow, startRow + rowCount) 行分词并写入倒排，第 i 行的文档ID为 baseDocId + (i - startRow)。
     *
     * <p>先对全部行分词，全部成功后才写入；任一行失败时本次调用不留下任何结果。
     *
     * @throws AnalyzerException 某行分词失败，携带行号
     * @throws OutOfOrderDocumentException baseDocId 不大于本实例已用过的文档ID
     * @throws AlreadyFinalizedException 已调用过 {@link #generatePosting()}
     */
    public void invertColumn(ColumnVector column, int startRow, int rowCount, int baseDocId) {
        ensureMutable("invertColumn");
        if (column == null) {
            throw new IllegalArgumentException("column 不能为null");
        }
        if (startRow < 0 || rowCount < 0 || startRow + rowCount > column.size()) {
            throw new IndexOutOfBoundsException("行区间越界: startRow=" + startRow + ", rowCount=" + rowCount
                + ", columnSize=" + column.size());
        }
        if (baseDocId < 0) {
            throw new IllegalArgumentException("baseDocId 不能为负数: " + baseDocId);
        }
        if (rowCount == 0) {
            return;
        }
        int nextDocId = nextDocId();
        if (docCount > 0 && baseDocId < nextDocId) {
            throw new OutOfOrderDocumentException("*", nextDocId - 1, baseDocId);
        }

        List<DocumentTerms> documents = new ArrayList<>(rowCount);
        for (int row = startRow; row < startRow + rowCount; row++) {
            documents.add(analyze(column, row));
        }

        if (docCount == 0) {
            firstDocId = baseDocId;
        } else {
            appendEmptyDocuments(baseDocId - nextDocId);
        }
        for (int index = 0; index < documents.size(); index++) {
            int docId = baseDocId + index;
            DocumentTerms document = documents.get(index);
            for (Map.Entry<String, List<Integer>> entry : document.positions().entrySet()) {
                PostingWriter writer = postings.computeIfAbsent(entry.getKey(), provider::get);
                int[] positions = toArray(entry.getValue());
                writer.appendDocument(docId, positions.length, positions);
            }
            appendTermCount(document.tokenCount());
        }
        sortedTerms = null;
        logger.debug("倒排完成: rows=[{}, {}), baseDocId={}, terms={}", startRow, startRow + rowCount, baseDocId, postings.size());
    }

    /**
     * 吸收另一个覆盖后续文档区间的倒排器。同名词项的倒排接在本实例之后，其余词项直接接管。
     * 合并后 other 不可再用。
     *
     * @throws OutOfOrderDocumentException other 的首个文档ID不大于本实例的最后文档ID
     */
    public void merge(ColumnInverter other) {
        ensureMutable("merge");
        if (other == null || other == this) {
            throw new IllegalArgumentException("合并来源非法");
        }
        other.ensureMutable("merge");
        if (other.docCount == 0) {
            other.consumed = true;
            return;
        }
        if (docCount > 0 && other.firstDocId < nextDocId()) {
            throw new OutOfOrderDocumentException("*", nextDocId() - 1, other.firstDocId);
        }

        for (Map.Entry<String, PostingWriter> entry : other.postings.entrySet()) {
            PostingWriter mine = postings.get(entry.getKey());
            if (mine != null && !mine.getOption().equals(entry.getValue().getOption())) {
                throw new IllegalArgumentException("倒排格式不一致: term=" + entry.getKey());
            }
        }
        for (Map.Entry<String, PostingWriter> entry : other.postings.entrySet()) {
            PostingWriter mine = postings.get(entry.getKey());
            PostingWriter theirs = entry.getValue();
            if (mine == null) {
                postings.put(entry.getKey(), theirs);
            } else if (mine != theirs) {
                mine.appendFrom(theirs);
                theirs.discard();
            }
        }

        if (docCount == 0) {
            firstDocId = other.firstDocId;
        } else {
            appendEmptyDocuments(other.firstDocId - nextDocId());
        }
        for (int index = 0; index < other.docCount; index++) {
            appendTermCount(other.termCounts[index]);
        }
        sortedTerms = null;
        other.postings.clear();
        other.consumed = true;
        logger.debug("合并完成: firstDocId={}, docCount={}, terms={}", firstDocId, docCount, postings.size());
    }

    /**
     * 按词项字典序排列当前全部倒排。
     */
    public List<Map.Entry<String, PostingWriter>> sort() {
        ensureUsable("sort");
        List<Map.Entry<String, PostingWriter>> entries = new ArrayList<>(postings.entrySet());
        entries.sort(Map.Entry.comparingByKey());
        sortedTerms = Collections.unmodifiableList(entries);
        return sortedTerms;
    }

    /**
     * 封存全部倒排。先确认没有已封存的构建器，再逐个封存。
     *
     * @throws IllegalStateException 未先调用 {@link #sort()}，或排序后又有写入
     * @throws AlreadyFinalizedException 重复调用，或某个构建器已被外部封存
     */
    public void generatePosting() {
        ensureMutable("generatePosting");
        if (sortedTerms == null) {
            throw new IllegalStateException("generatePosting 之前必须先调用 sort()");
        }
        for (Map.Entry<String, PostingWriter> entry : sortedTerms) {
            if (entry.getValue().isFinalized()) {
                throw new AlreadyFinalizedException("generatePosting", "term=" + entry.getKey());
            }
        }
        for (Map.Entry<String, PostingWriter> entry : sortedTerms) {
            entry.getValue().finalizePosting();
        }
        generated = true;
        logger.info("倒排封存完成: terms={}, docs={}", sortedTerms.size(), docCount);
    }

    /**
     * 把本实例覆盖文档的词元数写入 array 的 [firstDocId, firstDocId + docCount)。
     */
    public void getTermListLength(ColumnLengthArray array) {
        if (array == null) {
            throw new IllegalArgumentException("array 不能为null");
        }
        ensureUsable("getTermListLength");
        if (docCount == 0) {
            return;
        }
        array.writeRange(firstDocId, Arrays.copyOf(termCounts, docCount));
    }

    /**
     * 已排序的词项列表，未排序或排序后有写入时为 null。
     */
    public List<Map.Entry<String, PostingWriter>> getSortedTerms() {
        return sortedTerms;
    }

    public PostingWriter getPostingWriter(String term) {
        return postings.get(term);
    }

    public int getTermCount() {
        return postings.size();
    }

    /**
     * 覆盖的文档数，包括没有词元的文档。
     */
    public int getDocCount() {
        return docCount;
    }

    /**
     * 第一个文档ID，空实例为 -1。
     */
    public int getFirstDocId() {
        return firstDocId;
    }

    public boolean isGenerated() {
        return generated;
    }

    private DocumentTerms analyze(ColumnVector column, int row) {
        String value = column.getValue(row);
        if (value == null || value.isEmpty()) {
            return new DocumentTerms(Map.of(), 0);
        }
        List<Token> tokens;
        try {
            tokens = analyzer.tokenize(value);
        } catch (RuntimeException exception) {
            throw new AnalyzerException("分词失败", row, exception);
        }
        Map<String, List<Integer>> positions = new LinkedHashMap<>();
        for (Token token : tokens) {
            List<Integer> termPositions = positions.computeIfAbsent(token.term(), key -> new ArrayList<>());
            if (!termPositions.isEmpty() && termPositions.get(termPositions.size() - 1) >= token.position()) {
                throw new AnalyzerException("词元位置未严格递增: term=" + token.term(), row, null);
            }
            termPositions.add(token.position());
        }
        return new DocumentTerms(positions, tokens.size());
    }

    private int nextDocId() {
        return firstDocId + docCount;
    }

    private void appendEmptyDocuments(int count) {
        for (int index = 0; index < count; index++) {
            appendTermCount(0);
        }
    }

    private void appendTermCount(int count) {
        if (docCount == termCounts.length) {
            termCounts = Arrays.copyOf(termCounts, termCounts.length * 2);
        }
        termCounts[docCount++] = count;
    }

    private static int[] toArray(List<Integer> values) {
        int[] result = new int[values.size()];
        for (int index = 0; index < result.length; index++) {
            result[index] = values.get(index);
        }
        return result;
    }

    private void ensureMutable(String operation) {
        ensureUsable(operation);
        if (generated) {
            throw new AlreadyFinalizedException(operation, "倒排器已封存");
        }
    }

    private void ensureUsable(String operation) {
        if (consumed) {
            throw new IllegalStateException("倒排器已被合并，不可再用: operation=" + operation);
        }
    }

    private record DocumentTerms(Map<String, List<Integer>> positions, int tokenCount) {
    }
}
