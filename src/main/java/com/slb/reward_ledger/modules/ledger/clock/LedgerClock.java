package com.slb.reward_ledger.modules.ledger.clock;

/**
 * 账本时间源，单位为秒。允许回拨：账本取其与上次结算时间中的较大者。
 */
@FunctionalInterface
public interface LedgerClock {

    long currentTime();
}
