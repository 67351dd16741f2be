package com.corpussearch.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    @Test
    @DisplayName("SimpleTokenizer: 按非字母数字切分并保留偏移")
    void testSimpleTokenizerOffsets() {
        SimpleTokenizer tokenizer = new SimpleTokenizer();

        List<Token> tokens = tokenizer.tokenize("A-1 bb, Ccc!");

        assertEquals(4, tokens.size());
        assertToken(tokens.get(0), "A", 0, 1);
        assertToken(tokens.get(1), "1", 2, 3);
        assertToken(tokens.get(2), "bb", 4, 6);
        assertToken(tokens.get(3), "Ccc", 8, 11);
    }

    @Test
    @DisplayName("SimpleTokenizer: 保留单字符词项，不做大小写转换")
    void testSimpleTokenizerKeepsSingleCharacters() {
        SimpleTokenizer tokenizer = new SimpleTokenizer();

        assertEquals(List.of("a", "B", "c"), tokenizer.strings("a B c"));
    }

    @Test
    @DisplayName("SimpleTokenizer: 非ASCII字母与数字")
    void testSimpleTokenizerUnicode() {
        SimpleTokenizer tokenizer = new SimpleTokenizer();

        assertEquals(List.of("blåbærsyltetøy", "2024", "中文"), tokenizer.strings("blåbærsyltetøy—2024 (中文)"));
    }

    @Test
    @DisplayName("SimpleTokenizer: 空输入")
    void testSimpleTokenizerEmpty() {
        SimpleTokenizer tokenizer = new SimpleTokenizer();

        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize(" ,.!? ").isEmpty());
    }

    @Test
    @DisplayName("SimpleNormalizer: NFKC规范化与小写")
    void testSimpleNormalizer() {
        SimpleNormalizer normalizer = new SimpleNormalizer();

        assertEquals("ABC", normalizer.canonicalize("ＡＢＣ"));
        assertEquals("fi", normalizer.canonicalize("ﬁ"));
        assertEquals("", normalizer.canonicalize(null));
        assertEquals("hello", normalizer.normalize("HeLLo"));
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    @DisplayName("ShingleTokenizer: 重叠窗口与偏移")
    void testShingleTokenizerWindows() {
        ShingleTokenizer tokenizer = new ShingleTokenizer(3);

        List<Token> tokens = tokenizer.tokenize("mouse");

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), "mou", 0, 3);
        assertToken(tokens.get(1), "ous", 1, 4);
        assertToken(tokens.get(2), "use", 2, 5);
        assertEquals(List.of("a c", " ca", "cat"), tokenizer.strings("a cat"));
    }

    @Test
    @DisplayName("ShingleTokenizer: 文本不长于宽度时整段作为一个shingle")
    void testShingleTokenizerShortText() {
        ShingleTokenizer tokenizer = new ShingleTokenizer(4);

        assertEquals(List.of("ab"), tokenizer.strings("ab"));
        assertEquals(List.of("abcd"), tokenizer.strings("abcd"));
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
    }

    @Test
    @DisplayName("ShingleTokenizer: 按码点切分，不拆开代理对")
    void testShingleTokenizerCodePoints() {
        ShingleTokenizer tokenizer = new ShingleTokenizer(2);

        List<Token> tokens = tokenizer.tokenize("a😀b");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "a😀", 0, 3);
        assertToken(tokens.get(1), "😀b", 1, 4);
    }

    @Test
    @DisplayName("ShingleTokenizer: 宽度至少为1")
    void testShingleTokenizerRejectsInvalidWidth() {
        assertThrows(IllegalArgumentException.class, () -> new ShingleTokenizer(0));
        assertThrows(IllegalArgumentException.class, () -> new ShingleTokenizer(-2));
        assertEquals(List.of("a", "b"), new ShingleTokenizer(1).strings("ab"));
    }

    private void assertToken(Token token, String term, int startOffset, int endOffset) {
        assertEquals(term, token.term());
        assertEquals(startOffset, token.startOffset());
        assertEquals(endOffset, token.endOffset());
    }
}
