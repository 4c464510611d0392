package com.learn.pairexchange.bean;

import com.learn.pairexchange.ApiError;
import com.learn.pairexchange.ApiException;

import java.math.BigInteger;

public class DepositRequestBean implements ValidatableBean {

    public String accountId;
    public String asset;
    public BigInteger amount;

    @Override
    public void validate() {
        if(this.accountId == null || this.accountId.isBlank())
            throw new ApiException(ApiError.PARAMETER_INVALID, "accountId", "accountId is required.");
        if(this.asset == null || this.asset.isBlank())
            throw new ApiException(ApiError.PARAMETER_INVALID, "asset", "asset is required.");
        if(this.amount == null || this.amount.signum() <= 0)
            throw new ApiException(ApiError.PARAMETER_INVALID, "amount", "amount must be positive.");
    }
}
