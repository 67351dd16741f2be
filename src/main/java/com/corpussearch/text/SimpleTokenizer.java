package com.corpussearch.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 以连续的字母或数字作为一个词项，其余字符都视为分隔符。
 *
 * 单字符词项保留，大小写不做处理，交给 {@link Normalizer}。
 */
public class SimpleTokenizer implements Tokenizer {

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int cursor = 0;
        while (cursor < text.length()) {
            int codePoint = text.codePointAt(cursor);
            if (!isTermChar(codePoint)) {
                cursor += Character.charCount(codePoint);
                continue;
            }
            int segmentStart = cursor;
            while (cursor < text.length() && isTermChar(text.codePointAt(cursor))) {
                cursor += Character.charCount(text.codePointAt(cursor));
            }
            tokens.add(new Token(text.substring(segmentStart, cursor), segmentStart, cursor));
        }
        return List.copyOf(tokens);
    }

    private boolean isTermChar(int codePoint) {
        return Character.isLetterOrDigit(codePoint);
    }
}
