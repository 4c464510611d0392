package com.learn.pairexchange.bean;

import com.learn.pairexchange.ApiError;
import com.learn.pairexchange.ApiException;
import com.learn.pairexchange.util.UnsignedMath;

import java.math.BigInteger;

public class OrderRequestBean implements ValidatableBean {

    public String beneficiary;
    public BigInteger price;
    public BigInteger quantity;

    @Override
    public void validate() {
        if(this.beneficiary == null || this.beneficiary.isBlank())
            throw new ApiException(ApiError.PARAMETER_INVALID, "beneficiary", "beneficiary is required.");
        requireUint64(this.price, "price");
        // 数量为 0 交给撮合引擎拒绝 (ZERO_QUANTITY)
        requireUint64(this.quantity, "quantity");
    }

    public long priceValue() {
        return UnsignedMath.fromBigInteger(this.price);
    }

    public long quantityValue() {
        return UnsignedMath.fromBigInteger(this.quantity);
    }

    static void requireUint64(BigInteger value, String field) {
        if(value == null)
            throw new ApiException(ApiError.PARAMETER_INVALID, field, field + " is required.");
        if(value.signum() < 0 || value.compareTo(UnsignedMath.MAX_BIG_VALUE) > 0)
            throw new ApiException(ApiError.PARAMETER_INVALID, field, field + " must be in uint64 range.");
    }
}
