package com.learn.pairexchange.match;

// 堆顶元素的选择规则, 优先级按 uint64 比较
public enum PriorityOrder {
    // 价格高优先 (买单)
    HIGHEST_FIRST,

    // 价格低优先 (卖单)
    LOWEST_FIRST;
}
