package com.ftindex.invert;

import com.ftindex.column.TextColumnVector;
import com.ftindex.config.Constants;
import com.ftindex.memory.BlockArena;
import com.ftindex.memory.PostingArenas;
import com.ftindex.posting.AlreadyFinalizedException;
import com.ftindex.posting.OutOfOrderDocumentException;
import com.ftindex.posting.PostingBlock;
import com.ftindex.posting.PostingDecoder;
import com.ftindex.posting.PostingFormatOption;
import com.ftindex.posting.PostingIterator;
import com.ftindex.posting.PostingWriter;
import com.ftindex.posting.SegmentPosting;
import com.ftindex.text.Analyzer;
import com.ftindex.text.AnalyzerException;
import com.ftindex.text.StandardAnalyzer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColumnInverterTest {

    // https://en.wikipedia.org/wiki/Finite-state_transducer
    private static final List<String> PARAGRAPHS = List.of(
        "A finite-state transducer (FST) is a finite-state machine with two memory tapes, following the terminology for Turing machines: an input tape and an output tape. This contrasts with an ordinary finite-state automaton, which has a single tape. An FST is a type of finite-state automaton (FSA) that maps between two sets of symbols.[1] An FST is more general than an FSA. An FSA defines a formal language by defining a set of accepted strings, while an FST defines a relation between sets of strings.",
        "An FST will read a set of strings on the input tape and generates a set of relations on the output tape. An FST can be thought of as a translator or relater between strings in a set.",
        "In morphological parsing, an example would be inputting a string of letters into the FST, the FST would then output a string of morphemes.",
        "An automaton can be said to recognize a string if we view the content of its tape as input. In other words, the automaton computes a function that maps strings into the set {0,1}. Alternatively, we can say that an automaton generates strings, which means viewing its tape as an output tape. On this view, the automaton generates a formal language, which is a set of strings. The two views of automata are equivalent: the function that the automaton computes is precisely the indicator function of the set of strings it generates. The class of languages generated by finite automata is known as the class of regular languages.",
        "The two tapes of a transducer are typically viewed as an input tape and an output tape. On this view, a transducer is said to transduce (i.e., translate) the contents of its input tape to its output tape, by accepting a string on its input tape and generating another string on its output tape. It may do so nondeterministically and it may produce more than one output for each input string. A transducer may also produce no output for a given input string, in which case it is said to reject the input. In general, a transducer computes a relation between two formal languages.");

    @TempDir
    Path tempDir;

    private record ExpectedPosting(String term, long[] docIds, int[] termFreqs) {
    }

    private static PostingArenas arenas() {
        return new PostingArenas(new BlockArena(32, 1 << 14), new BlockArena(256, 1 << 14));
    }

    @Test
    @DisplayName("两段倒排合并后与预期倒排一致，列长度按区间落盘")
    void invertSplitColumnAndMerge() throws IOException {
        TextColumnVector column = new TextColumnVector(PARAGRAPHS);
        List<ExpectedPosting> expectedPostings = List.of(
            new ExpectedPosting("fst", new long[] {0, 1, 2}, new int[] {4, 2, 2}),
            new ExpectedPosting("automaton", new long[] {0, 3}, new int[] {2, 5}),
            new ExpectedPosting("transducer", new long[] {0, 4}, new int[] {1, 4}));

        MapPostingWriterProvider provider = new MapPostingWriterProvider(PostingFormatOption.ALL, arenas());
        ColumnLengthArray columnLengths = new ColumnLengthArray();
        Path lengthFile = tempDir.resolve("chunk1" + Constants.LENGTH_SUFFIX);
        try (ColumnLengthFileHandler handler = new ColumnLengthFileHandler(lengthFile)) {
            ColumnLengthUpdateJob updateJob1 = new ColumnLengthUpdateJob(handler, 3, 0, columnLengths);
            ColumnLengthUpdateJob updateJob2 = new ColumnLengthUpdateJob(handler, 2, 3, columnLengths);
            ColumnInverter inverter1 = new ColumnInverter("standard", provider);
            ColumnInverter inverter2 = new ColumnInverter("standard", provider);
            inverter1.invertColumn(column, 0, 3, 0);
            inverter2.invertColumn(column, 3, 2, 3);
            inverter1.getTermListLength(updateJob1.getColumnLengthArray());
            inverter2.getTermListLength(updateJob2.getColumnLengthArray());
            updateJob1.dumpToFile();
            updateJob2.dumpToFile();
            updateJob1.close();
            updateJob2.close();

            inverter1.merge(inverter2);
            inverter1.sort();
            inverter1.generatePosting();
            assertEquals(5, inverter1.getDocCount());
        }

        for (ExpectedPosting expected : expectedPostings) {
            PostingWriter posting = provider.postings().get(expected.term());
            assertNotNull(posting, expected.term());
            assertEquals(expected.docIds().length, posting.getDocFreq());

            PostingIterator iterator = new PostingIterator(PostingFormatOption.ALL);
            iterator.init(List.of(new SegmentPosting(0L, posting.getPostingBlock())));
            long docId = Constants.INVALID_ROW_ID;
            for (int index = 0; index < expected.docIds().length; index++) {
                docId = iterator.seekDoc(expected.docIds()[index]);
                assertEquals(expected.docIds()[index], docId);
                assertEquals(expected.termFreqs()[index], iterator.getCurrentTF());
            }
            assertEquals(Constants.INVALID_ROW_ID, iterator.seekDoc(docId + 1));
        }

        int[] expectedLengths = new int[PARAGRAPHS.size()];
        StandardAnalyzer analyzer = new StandardAnalyzer();
        for (int row = 0; row < PARAGRAPHS.size(); row++) {
            expectedLengths[row] = analyzer.tokenize(PARAGRAPHS.get(row)).size();
        }
        assertArrayEquals(expectedLengths, columnLengths.snapshot(0, PARAGRAPHS.size()));
        assertArrayEquals(expectedLengths, ColumnLengthFileHandler.readFile(lengthFile));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 17, 39, 40})
    @DisplayName("任意切分后合并与单次倒排结果一致")
    void splitThenMergeEqualsSingleInversion(int splitRow) {
        TextColumnVector column = randomColumn(40, new Random(17));

        ColumnInverter whole = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas(), 4));
        whole.invertColumn(column, 0, column.size(), 0);
        ColumnLengthArray wholeLengths = new ColumnLengthArray();
        whole.getTermListLength(wholeLengths);
        whole.sort();
        whole.generatePosting();

        ColumnInverter head = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas(), 4));
        ColumnInverter tail = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas(), 4));
        head.invertColumn(column, 0, splitRow, 0);
        tail.invertColumn(column, splitRow, column.size() - splitRow, splitRow);
        head.merge(tail);
        ColumnLengthArray splitLengths = new ColumnLengthArray();
        head.getTermListLength(splitLengths);
        head.sort();
        head.generatePosting();

        List<String> wholeTerms = terms(whole);
        assertEquals(wholeTerms, terms(head));
        for (String term : wholeTerms) {
            assertEquals(dump(whole.getPostingWriter(term).getPostingBlock()),
                dump(head.getPostingWriter(term).getPostingBlock()), term);
        }
        assertEquals(column.size(), head.getDocCount());
        assertArrayEquals(wholeLengths.snapshot(0, column.size()), splitLengths.snapshot(0, column.size()));
    }

    @Test
    @DisplayName("分词失败时本次调用不留下任何结果")
    void analyzerFailureCommitsNothing() {
        Analyzer failing = text -> {
            if (text.contains("boom")) {
                throw new IllegalStateException("cannot analyze");
            }
            return new StandardAnalyzer().tokenize(text);
        };
        MapPostingWriterProvider provider = new MapPostingWriterProvider(PostingFormatOption.ALL, arenas());
        ColumnInverter inverter = new ColumnInverter(failing, provider);
        TextColumnVector column = new TextColumnVector(List.of("alpha beta", "beta gamma", "boom", "delta"));

        AnalyzerException exception = assertThrows(AnalyzerException.class, () -> inverter.invertColumn(column, 0, 4, 0));

        assertEquals(2, exception.getRowIndex());
        assertTrue(exception.getCause() instanceof IllegalStateException);
        assertEquals(0, inverter.getDocCount());
        assertEquals(0, inverter.getTermCount());
        assertTrue(provider.postings().isEmpty());

        inverter.invertColumn(column, 0, 2, 0);
        assertEquals(2, inverter.getPostingWriter("beta").getDocFreq());
    }

    @Test
    void lifecycleIsEnforced() {
        TextColumnVector column = new TextColumnVector(List.of("a b", "b c"));
        ColumnInverter inverter = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas()));
        inverter.invertColumn(column, 0, 2, 0);

        assertThrows(IllegalStateException.class, inverter::generatePosting);
        inverter.sort();
        inverter.generatePosting();

        assertTrue(inverter.isGenerated());
        assertTrue(inverter.getPostingWriter("b").isFinalized());
        assertThrows(AlreadyFinalizedException.class, inverter::generatePosting);
        assertThrows(AlreadyFinalizedException.class, () -> inverter.invertColumn(column, 0, 1, 5));
        ColumnInverter other = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas()));
        other.invertColumn(column, 0, 1, 10);
        assertThrows(AlreadyFinalizedException.class, () -> inverter.merge(other));
    }

    @Test
    void invertAfterSortInvalidatesSortedTerms() {
        TextColumnVector column = new TextColumnVector(List.of("b a", "c"));
        ColumnInverter inverter = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas()));
        inverter.invertColumn(column, 0, 1, 0);

        List<Map.Entry<String, PostingWriter>> sorted = inverter.sort();
        assertEquals(List.of("a", "b"), sorted.stream().map(Map.Entry::getKey).toList());

        inverter.invertColumn(column, 1, 1, 1);
        assertNull(inverter.getSortedTerms());
        assertThrows(IllegalStateException.class, inverter::generatePosting);
    }

    @Test
    void documentOrderIsEnforced() {
        TextColumnVector column = new TextColumnVector(List.of("x", "y", "z"));
        ColumnInverter inverter = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas()));
        inverter.invertColumn(column, 0, 2, 5);

        assertThrows(OutOfOrderDocumentException.class, () -> inverter.invertColumn(column, 2, 1, 6));

        ColumnInverter earlier = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas()));
        earlier.invertColumn(column, 2, 1, 0);
        assertThrows(OutOfOrderDocumentException.class, () -> inverter.merge(earlier));
        assertThrows(IndexOutOfBoundsException.class, () -> inverter.invertColumn(column, 2, 2, 100));
    }

    @Test
    @DisplayName("空值与文档ID空洞记为零长度")
    void emptyValuesAndGapsHaveZeroLength() {
        TextColumnVector column = new TextColumnVector(Arrays.asList("one two", null, "", "three"));
        ColumnInverter inverter = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas()));
        inverter.invertColumn(column, 0, 3, 0);
        inverter.invertColumn(column, 3, 1, 5);

        ColumnLengthArray lengths = new ColumnLengthArray();
        inverter.getTermListLength(lengths);

        assertEquals(6, inverter.getDocCount());
        assertArrayEquals(new int[] {2, 0, 0, 0, 0, 1}, lengths.snapshot(0, 6));
        assertEquals(5, inverter.getPostingWriter("three").getFirstDocId());
    }

    @Test
    void mergedInverterIsConsumed() {
        TextColumnVector column = new TextColumnVector(List.of("a", "a b"));
        ColumnInverter first = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas()));
        ColumnInverter second = new ColumnInverter(new StandardAnalyzer(),
            new MapPostingWriterProvider(PostingFormatOption.ALL, arenas()));
        first.invertColumn(column, 0, 1, 0);
        second.invertColumn(column, 1, 1, 1);

        first.merge(second);

        assertEquals(2, first.getPostingWriter("a").getDocFreq());
        assertEquals(1, first.getPostingWriter("b").getFirstDocId());
        assertThrows(IllegalStateException.class, second::sort);
        assertThrows(IllegalArgumentException.class, () -> first.merge(first));
    }

    private static TextColumnVector randomColumn(int rows, Random random) {
        String[] vocabulary = {"alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta"};
        TextColumnVector column = new TextColumnVector();
        for (int row = 0; row < rows; row++) {
            int words = random.nextInt(12);
            StringBuilder builder = new StringBuilder();
            for (int word = 0; word < words; word++) {
                builder.append(vocabulary[random.nextInt(vocabulary.length)]).append(' ');
            }
            column.append(builder.toString());
        }
        return column;
    }

    private static List<String> terms(ColumnInverter inverter) {
        return inverter.getSortedTerms().stream().map(Map.Entry::getKey).toList();
    }

    /**
     * 把倒排块展开成 docId:tf[positions] 文本。
     */
    private static List<String> dump(PostingBlock block) {
        List<String> entries = new ArrayList<>();
        PostingDecoder decoder = block.newDecoder();
        for (int docId = decoder.nextDoc(); docId != PostingDecoder.NO_MORE_DOCS; docId = decoder.nextDoc()) {
            StringBuilder builder = new StringBuilder().append(docId).append(':').append(decoder.freq()).append('[');
            for (int position = decoder.nextPosition(); position != Constants.INVALID_POSITION; position = decoder.nextPosition()) {
                builder.append(position).append(',');
            }
            entries.add(builder.append(']').toString());
        }
        return entries;
    }
}
