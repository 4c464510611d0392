package com.learn.pairexchange.bean;

import java.math.BigInteger;

public class PairBean {
    public long pairId;
    public String baseAsset;
    public String quoteAsset;
    public String custodyAccount;

    // 托管池: 买单冻结的 A, 卖单冻结的 B
    public BigInteger basePool;
    public BigInteger quotePool;

    public int bidCount;
    public int askCount;

    // 订单簿为空时为 null
    public BigInteger bestBid;
    public BigInteger bestAsk;

    public BigInteger dust;
}
