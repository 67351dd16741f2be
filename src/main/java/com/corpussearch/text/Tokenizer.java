package com.corpussearch.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为词项列表，保留原文偏移。
     */
    List<Token> tokenize(String text);

    /**
     * 只返回词项文本。
     */
    default List<String> strings(String text) {
        return tokenize(text).stream().map(Token::term).toList();
    }
}
