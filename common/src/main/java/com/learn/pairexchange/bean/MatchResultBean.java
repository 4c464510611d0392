package com.learn.pairexchange.bean;

import com.learn.pairexchange.enums.Direction;

import java.math.BigInteger;
import java.util.List;

public class MatchResultBean {
    public long pairId;
    public long orderId;
    public Direction direction;
    public BigInteger price;
    public BigInteger quantity;
    public List<SimpleMatchDetailRecord> matchDetails;
}
