package com.learn.pairexchange.bean;

import com.learn.pairexchange.ApiError;
import com.learn.pairexchange.ApiException;

public class PairRequestBean implements ValidatableBean {

    public String baseAsset;
    public String quoteAsset;

    @Override
    public void validate() {
        if(this.baseAsset == null || this.baseAsset.isBlank())
            throw new ApiException(ApiError.PARAMETER_INVALID, "baseAsset", "baseAsset is required.");
        if(this.quoteAsset == null || this.quoteAsset.isBlank())
            throw new ApiException(ApiError.PARAMETER_INVALID, "quoteAsset", "quoteAsset is required.");
        if(this.baseAsset.equals(this.quoteAsset))
            throw new ApiException(ApiError.PARAMETER_INVALID, "quoteAsset", "quoteAsset must differ from baseAsset.");
    }
}
