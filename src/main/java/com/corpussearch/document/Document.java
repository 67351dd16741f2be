package com.corpussearch.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 语料库中的一篇文档。
 *
 * @param docId 从0开始的稠密文档ID，与语料库遍历顺序一致
 * @param fields 命名字段，值为字符串或数字
 */
public record Document(int docId, Map<String, Object> fields) {
    public Document {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * 读取字段原始值，字段缺失或为null时返回默认值。
     */
    public Object getField(String name, Object defaultValue) {
        Object value = fields.get(name);
        return value == null ? defaultValue : value;
    }

    /**
     * 以文本形式读取字段，缺失时返回空串。
     */
    public String getText(String name) {
        Object value = fields.get(name);
        return value == null ? "" : value.toString();
    }
}
