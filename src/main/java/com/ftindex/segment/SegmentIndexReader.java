package com.ftindex.segment;

import com.ftindex.config.Constants;
import com.ftindex.invert.ColumnLengthFileHandler;
import com.ftindex.posting.PostingBlock;
import com.ftindex.posting.PostingFormatOption;
import com.ftindex.posting.PostingIterator;
import com.ftindex.posting.SegmentPosting;
import com.ftindex.posting.TermMeta;
import com.ftindex.posting.TermMetaLoader;
import com.ftindex.storage.IndexFileReader;
import com.ftindex.storage.StorageFileUtil;
import com.ftindex.storage.VarIntCodec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 只读打开一个段：词典全量载入内存，倒排文件内存映射，按词项返回倒排块或游标。
 */
public final class SegmentIndexReader implements AutoCloseable {
    private final Path directory;
    private final SegmentMeta meta;
    private final PostingFormatOption option;
    private final NavigableMap<String, DictionaryEntry> dictionary;
    private final FileChannel postingsChannel;
    private final MappedByteBuffer postings;

    private SegmentIndexReader(Path directory, SegmentMeta meta, NavigableMap<String, DictionaryEntry> dictionary,
                               FileChannel postingsChannel, MappedByteBuffer postings) {
        this.directory = directory;
        this.meta = meta;
        this.option = new PostingFormatOption(meta.optionFlags());
        this.dictionary = dictionary;
        this.postingsChannel = postingsChannel;
        this.postings = postings;
    }

    /**
     * 打开段并校验 CRC、magic 与版本。
     *
     * @throws IOException 文件缺失、损坏或格式不符
     */
    public static SegmentIndexReader open(Path directory, String segmentName) throws IOException {
        SegmentMeta meta = SegmentMeta.readFrom(SegmentFiles.meta(directory, segmentName));
        PostingFormatOption option = new PostingFormatOption(meta.optionFlags());
        NavigableMap<String, DictionaryEntry> dictionary =
            loadDictionary(SegmentFiles.dictionary(directory, segmentName), option, meta.termCount());

        Path postingsPath = SegmentFiles.postings(directory, segmentName);
        long dataLength = StorageFileUtil.verifyCrc32Footer(postingsPath);
        FileChannel channel = FileChannel.open(postingsPath, StandardOpenOption.READ);
        try {
            MappedByteBuffer mapped = channel.map(FileChannel.MapMode.READ_ONLY, 0L, dataLength);
            checkHeader(mapped, Constants.POSTINGS_MAGIC, option, postingsPath);
            return new SegmentIndexReader(directory, meta, dictionary, channel, mapped);
        } catch (IOException | RuntimeException exception) {
            channel.close();
            throw exception;
        }
    }

    /**
     * 把同一词项在多个段上的倒排合成一个游标，词项在某段不存在时跳过该段。
     *
     * @throws IllegalArgumentException 段之间格式不一致或行区间重叠
     */
    public static PostingIterator openIterator(Collection<SegmentIndexReader> readers, String term) throws IOException {
        if (readers == null || readers.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个段");
        }
        PostingFormatOption option = readers.iterator().next().option();
        List<SegmentPosting> segmentPostings = new ArrayList<>();
        for (SegmentIndexReader reader : readers) {
            Optional<PostingBlock> block = reader.postingBlock(term);
            if (block.isPresent()) {
                segmentPostings.add(new SegmentPosting(reader.meta.baseRowId(), block.get()));
            }
        }
        PostingIterator iterator = new PostingIterator(option);
        iterator.init(segmentPostings);
        return iterator;
    }

    public Optional<TermMeta> termMeta(String term) {
        DictionaryEntry entry = dictionary.get(term);
        return entry == null ? Optional.empty() : Optional.of(entry.termMeta());
    }

    /**
     * 解码词项的倒排块，字节流直接引用映射区。
     *
     * @throws IOException 倒排数据损坏
     */
    public Optional<PostingBlock> postingBlock(String term) throws IOException {
        DictionaryEntry entry = dictionary.get(term);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(decodeBlock(term, entry));
    }

    /**
     * 本段上该词项的游标，词项不存在时返回立即耗尽的游标。
     */
    public PostingIterator postingIterator(String term) throws IOException {
        return openIterator(List.of(this), term);
    }

    /**
     * 全部词项，按字典序。
     */
    public List<String> terms() {
        return new ArrayList<>(dictionary.keySet());
    }

    /**
     * 以 prefix 开头的词项，按字典序。
     */
    public List<String> prefixTerms(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return terms();
        }
        List<String> result = new ArrayList<>();
        for (String term : dictionary.tailMap(prefix, true).keySet()) {
            if (!term.startsWith(prefix)) {
                break;
            }
            result.add(term);
        }
        return result;
    }

    /**
     * 读取段的列长度文件。
     *
     * @throws IOException 文件缺失或损坏
     */
    public int[] columnLengths() throws IOException {
        return ColumnLengthFileHandler.readFile(SegmentFiles.lengths(directory, meta.segmentName()));
    }

    public SegmentMeta meta() {
        return meta;
    }

    public PostingFormatOption option() {
        return option;
    }

    public int termCount() {
        return dictionary.size();
    }

    @Override
    public void close() throws IOException {
        postingsChannel.close();
    }

    private PostingBlock decodeBlock(String term, DictionaryEntry entry) throws IOException {
        if (entry.postingsOffset() < 0 || entry.postingsOffset() >= postings.limit()) {
            throw new IOException("倒排偏移越界: term=" + term + ", offset=" + entry.postingsOffset());
        }
        ByteBuffer buffer = postings.duplicate();
        buffer.position((int) entry.postingsOffset());
        try {
            int docCount = VarIntCodec.readVarInt(buffer);
            int skipInterval = VarIntCodec.readVarInt(buffer);
            int lastDocId = VarIntCodec.readVarInt(buffer) - 1;
            if (skipInterval <= 0 || docCount != entry.termMeta().docFreq()) {
                throw new IOException("倒排头损坏: term=" + term + ", docCount=" + docCount + ", skipInterval=" + skipInterval);
            }
            int skipCount = docCount / skipInterval;
            int[] skipDocIds = new int[skipCount];
            int[] skipDocOffsets = new int[skipCount];
            int[] skipPosOffsets = new int[skipCount];
            for (int index = 0; index < skipCount; index++) {
                skipDocIds[index] = buffer.getInt();
                skipDocOffsets[index] = buffer.getInt();
                skipPosOffsets[index] = buffer.getInt();
            }
            ByteBuffer docBytes = slice(buffer, VarIntCodec.readVarInt(buffer));
            ByteBuffer posBytes = slice(buffer, VarIntCodec.readVarInt(buffer));
            TermMeta termMeta = entry.termMeta();
            return new PostingBlock(option, docCount, termMeta.totalTermFreq(), termMeta.payload(), lastDocId,
                skipInterval, skipDocIds, skipDocOffsets, skipPosOffsets, docBytes, posBytes);
        } catch (RuntimeException exception) {
            throw new IOException("倒排数据损坏: term=" + term + ", offset=" + entry.postingsOffset(), exception);
        }
    }

    private static ByteBuffer slice(ByteBuffer buffer, int length) {
        ByteBuffer slice = buffer.slice(buffer.position(), length);
        buffer.position(buffer.position() + length);
        return slice;
    }

    private static NavigableMap<String, DictionaryEntry> loadDictionary(Path path, PostingFormatOption option,
                                                                        int expectedTermCount) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("词典文件不存在: " + path);
        }
        long dataLength = StorageFileUtil.verifyCrc32Footer(path);
        TermMetaLoader loader = new TermMetaLoader(option);
        NavigableMap<String, DictionaryEntry> dictionary = new TreeMap<>();
        try (IndexFileReader reader = new IndexFileReader(path)) {
            int magic = reader.readInt();
            short version = reader.readShort();
            int flags = reader.readInt();
            checkHeader(magic, version, flags, Constants.DICT_MAGIC, option, path);
            int termCount = reader.readInt();
            if (termCount != expectedTermCount) {
                throw new IOException("词项数与元数据不一致: " + path + ", dictionary=" + termCount + ", meta=" + expectedTermCount);
            }
            String previous = null;
            for (int index = 0; index < termCount; index++) {
                byte[] termBytes = new byte[reader.readVarInt()];
                reader.readFully(termBytes);
                String term = new String(termBytes, StandardCharsets.UTF_8);
                if (previous != null && term.compareTo(previous) <= 0) {
                    throw new IOException("词典词项未严格递增: " + path + ", previous=" + previous + ", current=" + term);
                }
                TermMeta termMeta = loader.load(reader);
                long offset = reader.readLong();
                dictionary.put(term, new DictionaryEntry(termMeta, offset));
                previous = term;
            }
            if (reader.position() != dataLength) {
                throw new IOException("词典存在多余数据: " + path + ", consumed=" + reader.position() + ", dataLength=" + dataLength);
            }
        }
        return dictionary;
    }

    private static void checkHeader(ByteBuffer buffer, int expectedMagic, PostingFormatOption option, Path path) throws IOException {
        if (buffer.remaining() < Integer.BYTES + Short.BYTES + Integer.BYTES) {
            throw new IOException("文件头不完整: " + path);
        }
        checkHeader(buffer.getInt(0), buffer.getShort(Integer.BYTES), buffer.getInt(Integer.BYTES + Short.BYTES),
            expectedMagic, option, path);
    }

    private static void checkHeader(int magic, short version, int flags, int expectedMagic,
                                    PostingFormatOption option, Path path) throws IOException {
        if (magic != expectedMagic) {
            throw new IOException("文件 magic 不匹配: " + path + ", actual=0x" + Integer.toHexString(magic));
        }
        if (version != Constants.FORMAT_VERSION) {
            throw new IOException("不支持的文件版本: " + path + ", version=" + version);
        }
        if (flags != option.flags()) {
            throw new IOException("倒排格式与元数据不一致: " + path + ", flags=" + flags + ", meta=" + option.flags());
        }
    }

    private record DictionaryEntry(TermMeta termMeta, long postingsOffset) {
    }
}
