package com.learn.pairexchange.bean;

import java.math.BigInteger;

public record SimpleMatchDetailRecord(BigInteger price, BigInteger baseQuantity, BigInteger quoteQuantity,
                                      BigInteger dust, long bidOrderId, long askOrderId,
                                      String bidBeneficiary, String askBeneficiary) {
}
