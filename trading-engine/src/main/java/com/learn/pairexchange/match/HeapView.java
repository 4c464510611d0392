package com.learn.pairexchange.match;

// 只读视图, 外部只能查询不能修改订单簿
public interface HeapView<T> {

    int size();

    boolean isEmpty();

    HeapEntry<T> peekAt(int index);

    HeapEntry<T> peek();
}
