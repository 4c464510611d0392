package com.learn.pairexchange.support;

import com.learn.pairexchange.ApiError;
import com.learn.pairexchange.ApiErrorResponse;
import com.learn.pairexchange.ApiException;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.bind.annotation.ResponseStatus;

public abstract class AbstractApiController extends LoggerSupport {

    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @ExceptionHandler(ApiException.class)
    @ResponseBody
    public ApiErrorResponse handleException(HttpServletResponse resp, ApiException ex) {
        resp.setContentType("application/json;charset=utf-8");
        return ex.error;
    }

    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    @ExceptionHandler(Exception.class)
    @ResponseBody
    public ApiErrorResponse handleUnexpectedException(HttpServletResponse resp, Exception ex) {
        logger.error("unexpected error.", ex);
        resp.setContentType("application/json;charset=utf-8");
        return new ApiException(ApiError.INTERNAL_SERVER_ERROR, null, ex.getMessage()).error;
    }
}
