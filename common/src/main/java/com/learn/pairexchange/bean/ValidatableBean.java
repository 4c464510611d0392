package com.learn.pairexchange.bean;

public interface ValidatableBean {
    void validate();
}
