package com.learn.pairexchange.match;

import com.learn.pairexchange.util.UnsignedMath;

// 某一资产的托管总量, 等于该方向所有挂单数量之和
public class EscrowPool {
    public final String assetId;
    private long locked;

    public EscrowPool(String assetId) {
        this.assetId = assetId;
        this.locked = 0;
    }

    public void lock(long amount) {
        this.locked = UnsignedMath.addExact(this.locked, amount);
    }

    public void release(long amount) {
        if(Long.compareUnsigned(amount, this.locked) > 0)
            throw new IllegalStateException("Cannot release " + UnsignedMath.toString(amount) +
                    " from pool " + this);
        this.locked -= amount;
    }

    public long getLocked() {
        return this.locked;
    }

    void reset(long locked) {
        this.locked = locked;
    }

    @Override
    public String toString() {
        return "EscrowPool [asset=" + assetId + ", locked=" + UnsignedMath.toString(locked) + ']';
    }
}
