package com.corpussearch.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 把整段文本切成宽度固定、相互重叠的 k-shingle，例如 "mouse" 的 3-shingle 为 mou、ous、use。
 *
 * 配合 N-out-of-M 检索可以容忍拼写错误：一个错字只影响覆盖它的少数几个 shingle。
 * 文本短于宽度时整段作为一个 shingle。宽度按码点计算，空白与标点也计入窗口。
 */
public class ShingleTokenizer implements Tokenizer {
    private final int width;

    /**
     * @param width shingle宽度，至少为1
     */
    public ShingleTokenizer(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("shingle宽度必须至少为1: " + width);
        }
        this.width = width;
    }

    public int getWidth() {
        return width;
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        // 每个码点的起始偏移，末尾追加文本长度
        int codePointCount = text.codePointCount(0, text.length());
        int[] offsets = new int[codePointCount + 1];
        int cursor = 0;
        for (int index = 0; index < codePointCount; index++) {
            offsets[index] = cursor;
            cursor += Character.charCount(text.codePointAt(cursor));
        }
        offsets[codePointCount] = text.length();

        if (codePointCount <= width) {
            return List.of(new Token(text, 0, text.length()));
        }
        List<Token> tokens = new ArrayList<>(codePointCount - width + 1);
        for (int start = 0; start + width <= codePointCount; start++) {
            int startOffset = offsets[start];
            int endOffset = offsets[start + width];
            tokens.add(new Token(text.substring(startOffset, endOffset), startOffset, endOffset));
        }
        return List.copyOf(tokens);
    }
}
