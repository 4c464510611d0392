package com.learn.pairexchange.assets;

public enum Transfer {
    // 可用 -> 可用 (充值)
    AVAILABLE_TO_AVAILABLE,
    // 可用 -> 冻结 (下单托管)
    AVAILABLE_TO_FROZEN,
    // 冻结 -> 可用 (成交交割或退回)
    FROZEN_TO_AVAILABLE;
}
