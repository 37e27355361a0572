package com.slb.reward_ledger.modules.ledger.clock;

import java.time.Clock;

/**
 * 系统墙钟，NTP 校时可能使其回拨。
 */
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;

    public SystemLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long currentTime() {
        return clock.instant().getEpochSecond();
    }
}
