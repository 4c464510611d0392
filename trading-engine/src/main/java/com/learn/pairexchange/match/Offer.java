package com.learn.pairexchange.match;

import com.learn.pairexchange.util.UnsignedMath;

// 挂单: 剩余冻结数量与成交后收取对手资产的账户
public record Offer(long orderId, String beneficiary, long quantity) {

    public Offer {
        if(quantity == 0)
            throw new IllegalArgumentException("Offer quantity must be positive.");
    }

    public Offer withQuantity(long newQuantity) {
        return new Offer(this.orderId, this.beneficiary, newQuantity);
    }

    @Override
    public String toString() {
        return "Offer [orderId=" + orderId + ", beneficiary=" + beneficiary +
                ", quantity=" + UnsignedMath.toString(quantity) + ']';
    }
}
