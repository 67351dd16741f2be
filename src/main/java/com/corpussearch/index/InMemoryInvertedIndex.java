package com.corpussearch.index;

import com.corpussearch.document.Corpus;
import com.corpussearch.document.Document;
import com.corpussearch.storage.CompressedPostingList;
import com.corpussearch.storage.InMemoryPostingList;
import com.corpussearch.storage.Posting;
import com.corpussearch.storage.PostingList;
import com.corpussearch.text.Normalizer;
import com.corpussearch.text.Token;
import com.corpussearch.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 适用于小型语料库的内存倒排索引。
 *
 * 构造时一次性同步构建，之后只读。每篇文档把各索引字段的词频合并计数，不保留字段维度与位置。
 * 开启压缩时只压缩倒排列表，词典不压缩。
 */
public class InMemoryInvertedIndex implements InvertedIndex {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryInvertedIndex.class);

    private final Corpus corpus;
    private final Normalizer normalizer;
    private final Tokenizer tokenizer;
    private final boolean compressed;
    private final InMemoryDictionary dictionary = new InMemoryDictionary();
    private final List<PostingList> postingLists = new ArrayList<>();

    /**
     * 构建倒排索引。
     *
     * @param corpus 语料库
     * @param fields 参与索引的字段名
     * @param normalizer 归一化器
     * @param tokenizer 分词器
     * @param compressed 是否使用压缩倒排列表
     */
    public InMemoryInvertedIndex(
            Corpus corpus,
            List<String> fields,
            Normalizer normalizer,
            Tokenizer tokenizer,
            boolean compressed) {
        if (corpus == null || normalizer == null || tokenizer == null) {
            throw new IllegalArgumentException("corpus、normalizer与tokenizer不能为null");
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个索引字段");
        }
        this.corpus = corpus;
        this.normalizer = normalizer;
        this.tokenizer = tokenizer;
        this.compressed = compressed;
        buildIndex(List.copyOf(fields));
    }

    private void buildIndex(List<String> fields) {
        long startNanos = System.nanoTime();
        int documentCount = 0;
        for (Document document : corpus) {
            Map<String, Integer> frequencies = new LinkedHashMap<>();
            for (String field : fields) {
                for (String term : getTerms(document.getText(field))) {
                    frequencies.merge(term, 1, Integer::sum);
                }
            }
            for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
                int termId = dictionary.addIfAbsent(entry.getKey());
                if (termId == postingLists.size()) {
                    postingLists.add(compressed ? new CompressedPostingList() : new InMemoryPostingList());
                }
                postingLists.get(termId).appendPosting(new Posting(document.docId(), entry.getValue()));
            }
            documentCount++;
        }
        postingLists.replaceAll(PostingList::freeze);
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("倒排索引构建完成: documents={}, terms={}, fields={}, compressed={}, elapsedMs={}",
            documentCount, dictionary.size(), fields, compressed, elapsedMs);
    }

    @Override
    public List<String> getTerms(String text) {
        List<Token> tokens = tokenizer.tokenize(normalizer.canonicalize(text));
        List<String> terms = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            String term = normalizer.normalize(token.term());
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }

    @Override
    public Iterator<Posting> getPostingsIterator(String term) {
        OptionalInt termId = dictionary.getTermId(term);
        return termId.isPresent() ? postingLists.get(termId.getAsInt()).iterator() : Collections.emptyIterator();
    }

    @Override
    public int getDocumentFrequency(String term) {
        OptionalInt termId = dictionary.getTermId(term);
        return termId.isPresent() ? postingLists.get(termId.getAsInt()).size() : 0;
    }

    @Override
    public int getTermCount() {
        return dictionary.size();
    }

    /**
     * 词典的只读视图。
     */
    public Dictionary getDictionary() {
        return new ReadOnlyDictionary(dictionary);
    }

    public boolean isCompressed() {
        return compressed;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{");
        for (int termId = 0; termId < dictionary.size(); termId++) {
            if (termId > 0) {
                builder.append(", ");
            }
            builder.append(dictionary.getTerm(termId)).append('=').append(postingLists.get(termId));
        }
        return builder.append('}').toString();
    }

    private record ReadOnlyDictionary(Dictionary delegate) implements Dictionary {
        @Override
        public int addIfAbsent(String term) {
            throw new UnsupportedOperationException("索引构建完成后词典只读");
        }

        @Override
        public OptionalInt getTermId(String term) {
            return delegate.getTermId(term);
        }

        @Override
        public String getTerm(int termId) {
            return delegate.getTerm(termId);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public Iterator<String> iterator() {
            return delegate.iterator();
        }
    }
}
