package com.learn.pairexchange.match;

// price 为卖单挂单价; bidOffer/askOffer 为成交前的挂单
public record MatchDetailRecord(long price, long baseQuantity, long quoteQuantity, long dust,
                                Offer bidOffer, Offer askOffer) {
}
