package com.learn.pairexchange.enums;

public enum UserType {
    // 系统负债账户，充值资产从这里转出，余额可以为负
    DEBT("debt");

    private final String accountId;

    public String getInternalAccountId() {
        return this.accountId;
    }

    UserType(String accountId) {
        this.accountId = accountId;
    }
}
