package com.learn.pairexchange.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Array-backed binary heap keyed by an unsigned 64-bit priority.
 * <p>
 * The entry at index 0 is the best one according to the {@link PriorityOrder}.
 * Entries with equal priority come out in insertion order.
 */
public class PriorityHeap<T> implements HeapView<T> {
    public final PriorityOrder order;

    private final List<HeapEntry<T>> entries;
    private long nextSequence;

    public PriorityHeap(PriorityOrder order) {
        this.order = order;
        this.entries = new ArrayList<>();
        this.nextSequence = 0;
    }

    public HeapEntry<T> insert(long priority, T payload) {
        HeapEntry<T> entry = new HeapEntry<>(priority, this.nextSequence++, payload);
        insert(entry);
        return entry;
    }

    // 重新插入之前取出的元素, 保留原有的 sequence
    public void insert(HeapEntry<T> entry) {
        this.entries.add(entry);
        siftUp(this.entries.size() - 1);
    }

    public HeapEntry<T> extractMax() {
        if(this.entries.isEmpty())
            throw new IllegalStateException("Cannot extract from an empty queue.");
        HeapEntry<T> top = this.entries.get(0);
        HeapEntry<T> last = this.entries.remove(this.entries.size() - 1);
        if(!this.entries.isEmpty()) {
            this.entries.set(0, last);
            siftDown(0);
        }
        return top;
    }

    @Override
    public HeapEntry<T> peekAt(int index) {
        Objects.checkIndex(index, this.entries.size());
        return this.entries.get(index);
    }

    @Override
    public HeapEntry<T> peek() {
        return this.entries.isEmpty() ? null : this.entries.get(0);
    }

    @Override
    public int size() {
        return this.entries.size();
    }

    @Override
    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    // 按引用删除任意元素, 需要线性查找, 只用于回滚
    public boolean remove(HeapEntry<T> entry) {
        int index = -1;
        for(int i = 0; i < this.entries.size(); i++) {
            if(this.entries.get(i) == entry) {
                index = i;
                break;
            }
        }
        if(index < 0)
            return false;
        HeapEntry<T> last = this.entries.remove(this.entries.size() - 1);
        if(index < this.entries.size()) {
            this.entries.set(index, last);
            siftDown(index);
            siftUp(index);
        }
        return true;
    }

    long getNextSequence() {
        return this.nextSequence;
    }

    void resetSequence(long nextSequence) {
        this.nextSequence = nextSequence;
    }

    private void siftUp(int index) {
        HeapEntry<T> entry = this.entries.get(index);
        while(index > 0) {
            int parent = (index - 1) >>> 1;
            HeapEntry<T> p = this.entries.get(parent);
            if(!precedes(entry, p))
                break;
            this.entries.set(index, p);
            index = parent;
        }
        this.entries.set(index, entry);
    }

    private void siftDown(int index) {
        int size = this.entries.size();
        HeapEntry<T> entry = this.entries.get(index);
        int half = size >>> 1;
        while(index < half) {
            int child = 2 * index + 1;
            int right = child + 1;
            if(right < size && precedes(this.entries.get(right), this.entries.get(child)))
                child = right;
            HeapEntry<T> c = this.entries.get(child);
            if(!precedes(c, entry))
                break;
            this.entries.set(index, c);
            index = child;
        }
        this.entries.set(index, entry);
    }

    // a 是否应排在 b 之前
    boolean precedes(HeapEntry<T> a, HeapEntry<T> b) {
        int cmp = Long.compareUnsigned(a.priority(), b.priority());
        if(cmp == 0)
            return a.sequence() < b.sequence(); // 时间早在前
        return this.order == PriorityOrder.HIGHEST_FIRST ? cmp > 0 : cmp < 0;
    }

    @Override
    public String toString() {
        return "PriorityHeap [order=" + order + ", size=" + entries.size() + ']';
    }
}
