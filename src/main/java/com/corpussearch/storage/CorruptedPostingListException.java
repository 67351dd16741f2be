package com.corpussearch.storage;

/**
 * 压缩倒排列表解码失败，例如在VarInt中途截断。
 */
public class CorruptedPostingListException extends RuntimeException {
    private final int offset;

    public CorruptedPostingListException(String message, int offset) {
        super(message + " (offset=" + offset + ")");
        this.offset = offset;
    }

    /**
     * 出错位置在编码字节中的偏移。
     */
    public int getOffset() {
        return offset;
    }
}
