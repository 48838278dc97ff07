package com.xai.xaichain.consensus.orphan;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalCause;
import com.google.common.cache.RemovalNotification;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.OrphanEntry;
import com.xai.xaichain.network.PeerReputationReporter;
import com.xai.xaichain.util.ClockTicker;
import com.xai.xaichain.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 孤块池：按区块哈希保存父区块未知的区块，附带 父哈希 -> 子区块 的反向索引
 * 过期由 Guava Cache 的 TTL 驱动，时间取自注入的 Clock
 */
@Slf4j
public class OrphanBlockPool {

    private static final int MAX_TRACKED_PEERS = 10_000;

    private final Cache<String, OrphanEntry> orphans;

    private final Map<String, Set<String>> childrenByParent = new ConcurrentHashMap<>();

    // 节点 -> 统计窗口内的孤块过期次数，窗口从第一次过期开始计算
    private final Cache<String, AtomicInteger> expiredByPeer;

    private final Clock clock;
    private final PeerReputationReporter reputationReporter;
    private final int reportThreshold;

    public OrphanBlockPool(int maxBlocks, long ttlSeconds, int reportThreshold, Clock clock,
                           PeerReputationReporter reputationReporter) {
        this.clock = clock;
        this.reputationReporter = reputationReporter;
        this.reportThreshold = reportThreshold;
        this.orphans = CacheBuilder.newBuilder()
                .maximumSize(maxBlocks)
                .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
                .ticker(new ClockTicker(clock))
                .<String, OrphanEntry>removalListener(this::onRemoval)
                .build();
        this.expiredByPeer = CacheBuilder.newBuilder()
                .maximumSize(MAX_TRACKED_PEERS)
                .expireAfterWrite(ttlSeconds * Math.max(reportThreshold, 1), TimeUnit.SECONDS)
                .ticker(new ClockTicker(clock))
                .build();
    }

    /**
     * @return false 表示已存在
     */
    public boolean add(Block block, String sourcePeer) {
        String hash = block.getHashHex();
        if (orphans.getIfPresent(hash) != null) {
            return false;
        }
        orphans.put(hash, new OrphanEntry(block, clock.millis(), sourcePeer));
        childrenByParent.computeIfAbsent(CryptoUtil.bytesToHex(block.getPreviousHash()), k -> ConcurrentHashMap.newKeySet())
                .add(hash);
        log.info("添加孤儿区块: 哈希={}, 父哈希={}, 当前孤儿池大小={}",
                hash, CryptoUtil.bytesToHex(block.getPreviousHash()), orphans.size());
        return true;
    }

    public boolean contains(byte[] hash) {
        return orphans.getIfPresent(CryptoUtil.bytesToHex(hash)) != null;
    }

    /**
     * 取出并移除某个父区块的全部子孤块
     */
    public List<OrphanEntry> removeChildrenOf(byte[] parentHash) {
        Set<String> children = childrenByParent.remove(CryptoUtil.bytesToHex(parentHash));
        List<OrphanEntry> result = new ArrayList<>();
        if (children == null) {
            return result;
        }
        for (String childHash : children) {
            OrphanEntry entry = orphans.getIfPresent(childHash);
            if (entry != null) {
                result.add(entry);
                orphans.invalidate(childHash);
            }
        }
        return result;
    }

    /**
     * 执行挂起的过期清理
     */
    public void cleanUp() {
        orphans.cleanUp();
    }

    public long size() {
        return orphans.size();
    }

    private void onRemoval(RemovalNotification<String, OrphanEntry> notification) {
        OrphanEntry entry = notification.getValue();
        if (entry == null || notification.getCause() == RemovalCause.REPLACED) {
            return;
        }
        String parentKey = CryptoUtil.bytesToHex(entry.getBlock().getPreviousHash());
        Set<String> siblings = childrenByParent.get(parentKey);
        // 同一哈希可能已被重新加入
        if (siblings != null && orphans.getIfPresent(notification.getKey()) == null) {
            siblings.remove(notification.getKey());
            if (siblings.isEmpty()) {
                childrenByParent.remove(parentKey, siblings);
            }
        }
        RemovalCause cause = notification.getCause();
        if (cause == RemovalCause.EXPIRED) {
            log.info("孤儿区块已过期: {}", notification.getKey());
            countExpiry(entry.getSourcePeer());
        } else if (cause == RemovalCause.SIZE) {
            log.warn("孤儿池已满，淘汰区块: {}", notification.getKey());
        }
    }

    private void countExpiry(String peer) {
        if (peer == null) {
            return;
        }
        AtomicInteger counter = expiredByPeer.getIfPresent(peer);
        if (counter == null) {
            counter = new AtomicInteger();
            expiredByPeer.put(peer, counter);
        }
        int count = counter.incrementAndGet();
        if (count >= reportThreshold) {
            expiredByPeer.invalidate(peer);
            reputationReporter.reportRepeatedOrphans(peer, count);
        }
    }

    long trackedPeerCount() {
        expiredByPeer.cleanUp();
        return expiredByPeer.size();
    }
}
