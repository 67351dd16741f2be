package com.corpussearch.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 有界 top-k 收集器，保留目前为止得分最高的 k 个 (score, documentId)。
 *
 * 已满时只有得分严格大于当前最差项的新条目才会替换它。得分相同时先筛入的排在前面。
 */
public final class Sieve {
    /** 堆顶为最差条目：得分低者更差，得分相同时后筛入者更差 */
    private static final Comparator<Entry> WORST_FIRST = Comparator
        .comparingDouble(Entry::score)
        .thenComparing(Comparator.comparingLong(Entry::sequence).reversed());

    private final int capacity;
    private final PriorityQueue<Entry> heap;
    private long nextSequence;

    /**
     * @param capacity 最多保留的条目数，必须至少为1
     */
    public Sieve(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Sieve容量必须至少为1: " + capacity);
        }
        this.capacity = capacity;
        this.heap = new PriorityQueue<>(Math.min(capacity, 1024), WORST_FIRST);
    }

    /**
     * 记录一个候选结果。
     */
    public void sift(double score, int documentId) {
        Entry entry = new Entry(score, documentId, nextSequence++);
        if (heap.size() < capacity) {
            heap.add(entry);
            return;
        }
        Entry worst = heap.peek();
        if (score > worst.score()) {
            heap.poll();
            heap.add(entry);
        }
    }

    /**
     * 当前保留的结果，按得分降序，返回新的列表，不清空收集器。
     */
    public List<Winner> winners() {
        List<Entry> entries = new ArrayList<>(heap);
        entries.sort(WORST_FIRST.reversed());
        List<Winner> winners = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            winners.add(new Winner(entry.score(), entry.documentId()));
        }
        return winners;
    }

    public int size() {
        return heap.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * 一条保留结果。
     */
    public record Winner(double score, int documentId) {
    }

    private record Entry(double score, int documentId, long sequence) {
    }
}
