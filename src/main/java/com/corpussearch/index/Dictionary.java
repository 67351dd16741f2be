package com.corpussearch.index;

import java.util.OptionalInt;

/**
 * 词项与稠密整数ID之间的双向映射。ID按首次出现顺序分配，范围为 [0, size)，分配后不再变化。
 */
public interface Dictionary extends Iterable<String> {

    /**
     * 返回词项的ID，不存在时先分配再返回。
     */
    int addIfAbsent(String term);

    /**
     * 查找词项ID。
     */
    OptionalInt getTermId(String term);

    /**
     * 按ID取回词项。
     *
     * @throws IllegalArgumentException ID越界
     */
    String getTerm(int termId);

    /**
     * 词项数量。
     */
    int size();
}
