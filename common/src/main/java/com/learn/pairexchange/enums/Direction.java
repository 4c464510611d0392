package com.learn.pairexchange.enums;

public enum Direction {
    // 买单冻结 A 资产换取 B，卖单冻结 B 资产换取 A
    BID, ASK;
}
