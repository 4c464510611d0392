package com.learn.pairexchange;

public enum ApiError {
    PARAMETER_INVALID,

    PAIR_NOT_FOUND,

    NO_ENOUGH_ASSET,

    // 下单数量为 0
    ZERO_QUANTITY,

    // 卖单价格为 0
    ZERO_PRICE,

    // 价格与数量相乘超出 uint64 范围
    ARITHMETIC_OVERFLOW,

    INTERNAL_SERVER_ERROR;
}
