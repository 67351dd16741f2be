package com.corpussearch.storage;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 压缩倒排列表。
 *
 * 每条倒排项依次写入两个VarInt：文档ID相对上一条的增量（第一条为原始ID）与原始词频。
 * 以随机访问能力换取内存密度，只能顺序解码。
 */
public final class CompressedPostingList implements PostingList {
    /** 构建期的追加缓冲，冻结后为null */
    private final ByteArrayOutputStream buffer;
    /** 冻结后的编码字节，构建期为null */
    private final byte[] encoded;
    private int size;
    private int lastDocumentId = -1;

    public CompressedPostingList() {
        this.buffer = new ByteArrayOutputStream();
        this.encoded = null;
    }

    private CompressedPostingList(byte[] encoded, int size, int lastDocumentId, boolean frozen) {
        if (frozen) {
            this.buffer = null;
            this.encoded = encoded;
        } else {
            this.buffer = new ByteArrayOutputStream(encoded.length);
            this.buffer.writeBytes(encoded);
            this.encoded = null;
        }
        this.size = size;
        this.lastDocumentId = lastDocumentId;
    }

    /**
     * 从外部字节序列重建压缩倒排列表，返回前完整校验一遍。
     *
     * @param encoded 编码字节
     * @return 倒排列表
     * @throws CorruptedPostingListException 数据被截断或不满足递增约束
     */
    public static CompressedPostingList fromBytes(byte[] encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("encoded不能为null");
        }
        ByteBuffer buf = ByteBuffer.wrap(encoded);
        int count = 0;
        int documentId = -1;
        while (buf.hasRemaining()) {
            int postingStart = buf.position();
            int delta = VarIntCodec.readVarInt(buf);
            if (!buf.hasRemaining()) {
                throw new CorruptedPostingListException("倒排项缺少词频", postingStart);
            }
            int termFrequency = VarIntCodec.readVarInt(buf);
            if (count > 0 && delta == 0) {
                throw new CorruptedPostingListException("文档ID未严格递增", postingStart);
            }
            if (termFrequency < 1) {
                throw new CorruptedPostingListException("词频必须至少为1", postingStart);
            }
            long next = (long) (count == 0 ? 0 : documentId) + delta;
            if (next > Integer.MAX_VALUE) {
                throw new CorruptedPostingListException("文档ID溢出", postingStart);
            }
            documentId = (int) next;
            count++;
        }
        return new CompressedPostingList(encoded, count, documentId, false);
    }

    @Override
    public void appendPosting(Posting posting) {
        if (posting == null) {
            throw new IllegalArgumentException("posting不能为null");
        }
        if (isFrozen()) {
            throw new IllegalStateException("倒排列表已冻结，不能再追加");
        }
        if (posting.documentId() <= lastDocumentId) {
            throw new IllegalArgumentException(
                "documentId必须严格递增, last=" + lastDocumentId + ", current=" + posting.documentId());
        }
        int delta = size == 0 ? posting.documentId() : posting.documentId() - lastDocumentId;
        VarIntCodec.writeVarInt(delta, buffer);
        VarIntCodec.writeVarInt(posting.termFrequency(), buffer);
        lastDocumentId = posting.documentId();
        size++;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * 把编码字节收拢为一个定长数组并丢弃追加缓冲，返回的列表只读。
     */
    @Override
    public CompressedPostingList freeze() {
        if (isFrozen()) {
            return this;
        }
        return new CompressedPostingList(buffer.toByteArray(), size, lastDocumentId, true);
    }

    public boolean isFrozen() {
        return encoded != null;
    }

    /**
     * 返回编码字节的副本。
     */
    public byte[] toByteArray() {
        return isFrozen() ? Arrays.copyOf(encoded, encoded.length) : buffer.toByteArray();
    }

    /**
     * 编码后占用的字节数。
     */
    public int byteSize() {
        return isFrozen() ? encoded.length : buffer.size();
    }

    /**
     * 冻结后直接在编码字节上解码，不复制也不修改任何状态。构建期每次调用复制一次当前缓冲。
     */
    @Override
    public Iterator<Posting> iterator() {
        byte[] bytes = isFrozen() ? encoded : buffer.toByteArray();
        return new DecodingIterator(ByteBuffer.wrap(bytes).asReadOnlyBuffer(), size);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        Iterator<Posting> iterator = iterator();
        while (iterator.hasNext()) {
            builder.append(iterator.next());
            if (iterator.hasNext()) {
                builder.append(", ");
            }
        }
        return builder.append(']').toString();
    }

    private static final class DecodingIterator implements Iterator<Posting> {
        private final ByteBuffer buf;
        private final int count;
        private int decoded;
        private int documentId;

        private DecodingIterator(ByteBuffer buf, int count) {
            this.buf = buf;
            this.count = count;
        }

        @Override
        public boolean hasNext() {
            return decoded < count;
        }

        @Override
        public Posting next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int delta = VarIntCodec.readVarInt(buf);
            int termFrequency = VarIntCodec.readVarInt(buf);
            documentId = decoded == 0 ? delta : documentId + delta;
            decoded++;
            return new Posting(documentId, termFrequency);
        }
    }
}
