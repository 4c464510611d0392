package com.learn.pairexchange.match;

/**
 * One element of a {@link PriorityHeap}.
 *
 * @param priority unsigned 64-bit priority, the submitted price for order books
 * @param sequence insertion order, breaks ties between equal priorities
 * @param payload the stored value
 */
public record HeapEntry<T>(long priority, long sequence, T payload) {

    // 部分成交后替换 payload, 价格和时间优先级不变
    public HeapEntry<T> withPayload(T newPayload) {
        return new HeapEntry<>(this.priority, this.sequence, newPayload);
    }
}
