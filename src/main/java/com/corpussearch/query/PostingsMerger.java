package com.corpussearch.query;

import com.corpussearch.storage.Posting;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 倒排列表合并工具。
 *
 * 输入的两个迭代器都按文档ID升序，输出同样按文档ID升序且惰性产生。每侧最多预读一条倒排项，
 * 总代价为 O(|p1| + |p2|)。文档ID相同时输出 p1 的倒排项，p2 的词频不合并。
 */
public final class PostingsMerger {

    private PostingsMerger() {
        // 工具类，禁止实例化
    }

    /**
     * 两个倒排列表的 AND。
     */
    public static Iterator<Posting> intersection(Iterator<Posting> p1, Iterator<Posting> p2) {
        return new MergingIterator(p1, p2) {
            @Override
            protected Posting computeNext() {
                while (left != null && right != null) {
                    if (left.documentId() == right.documentId()) {
                        Posting match = left;
                        advanceLeft();
                        advanceRight();
                        return match;
                    }
                    if (left.documentId() < right.documentId()) {
                        advanceLeft();
                    } else {
                        advanceRight();
                    }
                }
                return null;
            }
        };
    }

    /**
     * 两个倒排列表的 OR。
     */
    public static Iterator<Posting> union(Iterator<Posting> p1, Iterator<Posting> p2) {
        return new MergingIterator(p1, p2) {
            @Override
            protected Posting computeNext() {
                Posting result;
                if (left == null && right == null) {
                    return null;
                }
                if (right == null || (left != null && left.documentId() < right.documentId())) {
                    result = left;
                    advanceLeft();
                } else if (left == null || right.documentId() < left.documentId()) {
                    result = right;
                    advanceRight();
                } else {
                    result = left;
                    advanceLeft();
                    advanceRight();
                }
                return result;
            }
        };
    }

    /**
     * 维护两侧各一条预读倒排项，子类在 {@link #computeNext()} 中决定输出哪一条，返回null表示结束。
     */
    private abstract static class MergingIterator implements Iterator<Posting> {
        private final Iterator<Posting> leftSource;
        private final Iterator<Posting> rightSource;
        protected Posting left;
        protected Posting right;
        private Posting pending;
        private boolean started;

        MergingIterator(Iterator<Posting> leftSource, Iterator<Posting> rightSource) {
            if (leftSource == null || rightSource == null) {
                throw new IllegalArgumentException("倒排迭代器不能为null");
            }
            this.leftSource = leftSource;
            this.rightSource = rightSource;
        }

        protected abstract Posting computeNext();

        protected void advanceLeft() {
            left = leftSource.hasNext() ? leftSource.next() : null;
        }

        protected void advanceRight() {
            right = rightSource.hasNext() ? rightSource.next() : null;
        }

        @Override
        public boolean hasNext() {
            if (!started) {
                advanceLeft();
                advanceRight();
                started = true;
            }
            if (pending == null) {
                pending = computeNext();
            }
            return pending != null;
        }

        @Override
        public Posting next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Posting result = pending;
            pending = null;
            return result;
        }
    }
}
