package com.xai.xaichain.util;

import com.google.common.base.Ticker;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * 让 Guava Cache 的过期时间跟随注入的 Clock
 */
public class ClockTicker extends Ticker {

    private final Clock clock;

    public ClockTicker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long read() {
        return TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }
}
