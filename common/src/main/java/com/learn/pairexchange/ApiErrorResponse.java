package com.learn.pairexchange;

public record ApiErrorResponse(ApiError error, String data, String message) {
}
