package com.xai.xaichain.service.mempool;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.xai.xaichain.util.ClockTicker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * 无效交易冷却：同一发送者在窗口内提交无效交易达到阈值后，禁止提交一段时间
 * 由交易池锁保护，本身不做同步
 */
@Slf4j
public class SenderBanTracker {

    private final int threshold;
    private final long windowMillis;
    private final Clock clock;

    // 发送者 -> 窗口内每次无效提交的时间（毫秒）
    private final Cache<String, Deque<Long>> invalidHistory;

    // 发送者 -> 解封时间（毫秒）
    private final Cache<String, Long> bans;

    public SenderBanTracker(int threshold, long windowSeconds, long banSeconds, Clock clock) {
        this.threshold = threshold;
        this.windowMillis = TimeUnit.SECONDS.toMillis(windowSeconds);
        this.clock = clock;
        ClockTicker ticker = new ClockTicker(clock);
        this.invalidHistory = CacheBuilder.newBuilder()
                .expireAfterAccess(windowSeconds, TimeUnit.SECONDS)
                .ticker(ticker)
                .build();
        this.bans = CacheBuilder.newBuilder()
                .expireAfterWrite(banSeconds, TimeUnit.SECONDS)
                .ticker(ticker)
                .build();
    }

    /**
     * 记录一次无效提交
     * @return 是否因此被封禁
     */
    public boolean recordInvalid(String sender) {
        if (sender == null) {
            return false;
        }
        long now = clock.millis();
        Deque<Long> history = invalidHistory.getIfPresent(sender);
        if (history == null) {
            history = new ArrayDeque<>();
            invalidHistory.put(sender, history);
        }
        history.addLast(now);
        while (!history.isEmpty() && history.peekFirst() <= now - windowMillis) {
            history.pollFirst();
        }
        if (history.size() >= threshold) {
            invalidHistory.invalidate(sender);
            bans.put(sender, now);
            log.warn("发送者 {} 在 {} 秒内提交了 {} 笔无效交易，进入冷却期", sender,
                    TimeUnit.MILLISECONDS.toSeconds(windowMillis), threshold);
            return true;
        }
        return false;
    }

    public boolean isBanned(String sender) {
        return sender != null && bans.getIfPresent(sender) != null;
    }

    public long bannedCount() {
        bans.cleanUp();
        return bans.size();
    }
}
