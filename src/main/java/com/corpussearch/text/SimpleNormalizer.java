package com.corpussearch.text;

import java.util.Locale;

/**
 * NFKC规范化整段文本，词项统一转为小写。
 */
public class SimpleNormalizer implements Normalizer {

    @Override
    public String canonicalize(String buffer) {
        if (buffer == null || buffer.isEmpty()) {
            return "";
        }
        return java.text.Normalizer.normalize(buffer, java.text.Normalizer.Form.NFKC);
    }

    @Override
    public String normalize(String token) {
        return token == null ? "" : token.toLowerCase(Locale.ROOT);
    }
}
