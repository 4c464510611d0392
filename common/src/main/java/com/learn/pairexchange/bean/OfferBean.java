package com.learn.pairexchange.bean;

import java.math.BigInteger;

// 订单簿中的一条挂单, 按堆数组位置输出, 不保证价格顺序
public record OfferBean(long orderId, String beneficiary, BigInteger price, BigInteger quantity) {
}
