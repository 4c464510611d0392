package com.learn.pairexchange.assets;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigInteger;

public class Asset {
    // 可用余额, 仅 DEBT 账户可以为负
    BigInteger available;
    // 冻结余额, 托管账户中等于订单簿托管池
    BigInteger frozen;

    public Asset() {
        this(BigInteger.ZERO, BigInteger.ZERO);
    }

    public Asset(BigInteger available, BigInteger frozen) {
        this.available = available;
        this.frozen = frozen;
    }

    public BigInteger getAvailable() {
        return available;
    }

    public BigInteger getFrozen() {
        return frozen;
    }

    @JsonIgnore
    public BigInteger getTotal() {
        return available.add(frozen);
    }

    @Override
    public String toString() {
        return "Asset [available=" + available + ", frozen=" + frozen + ']';
    }
}
