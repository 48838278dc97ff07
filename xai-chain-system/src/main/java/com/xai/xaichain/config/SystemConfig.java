package com.xai.xaichain.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 节点配置（application.yml 中 system.* ），字段默认值即生产默认值
 */
@Slf4j
@Data
@ConfigurationProperties(prefix = "system")
public class SystemConfig {

    private int netVersion = 1;

    // 存储路径
    private String storagePath = "db/";

    // rocksdb | memory
    private String storageType = "rocksdb";

    private Consensus consensus = new Consensus();

    private Mempool mempool = new Mempool();

    private Orphan orphan = new Orphan();

    private Checkpoint checkpoint = new Checkpoint();

    private Mining mining = new Mining();

    private Genesis genesis = new Genesis();

    @PostConstruct
    public void init() {
        log.info("网络版本:{}", netVersion);
        log.info("存储:{} 路径:{}", storageType, storagePath);
        log.info("最大重组深度:{} 未来时间容忍:{}秒 难度调整周期:{}",
                consensus.getMaxReorgDepth(), consensus.getMaxFutureDriftSeconds(), consensus.getRetargetInterval());
    }

    @Data
    public static class Consensus {
        // 目标出块时间（秒）
        private long targetBlockTimeSeconds = 120;
        // 难度调整周期（区块数），1 表示每个区块都调整
        private int retargetInterval = 100;
        // 最低难度（最大目标值）紧凑格式
        private String powLimitBits = "1f00ffff";
        // 区块到达时间超过父区块这么多秒后允许最低难度，0 关闭（仅测试网）
        private long minDifficultyGapSeconds = 0;
        // 区块时间允许超前本地时间的秒数
        private long maxFutureDriftSeconds = 7200;
        private int maxReorgDepth = 100;
        private int maxBlockSize = 2_097_152;
        private int maxTransactionsPerBlock = 10_000;
        private int maxTransactionSize = 102_400;
        // 初始区块奖励（最小单位），12 币
        private long initialReward = 12L * 100_000_000L;
        private long halvingInterval = 262_800;
        private int coinbaseMaturity = 100;
        // 账户交易 nonce 可超前的窗口
        private int futureNonceWindow = 16;
        // 受信任检查点 "高度:区块哈希"
        private List<String> trustedCheckpoints = new ArrayList<>();
    }

    @Data
    public static class Mempool {
        private int maxTransactions = 10_000;
        private long maxBytes = 10_485_760;
        private int maxPerSender = 100;
        // 最低手续费率（最小单位/字节），0.0000001 币/字节
        private long minFeeRate = 10;
        private int invalidThreshold = 3;
        private long invalidWindowSeconds = 900;
        private long invalidBanSeconds = 900;
        private long maxAgeSeconds = 86_400;
        private int maxOrphanTransactions = 1000;
        private int maxFutureTransactions = 1000;
        private boolean rbfEnabled = true;
    }

    @Data
    public static class Orphan {
        private int maxBlocks = 750;
        private long ttlSeconds = 1200;
        // 同一节点的孤块过期多少次后上报
        private int reportThreshold = 3;
    }

    @Data
    public static class Checkpoint {
        private int interval = 1000;
        private int keep = 10;
    }

    @Data
    public static class Mining {
        private boolean enabled = false;
        private String minerAddress;
        // 接受其他节点区块后，本地矿工等待的毫秒数
        private long cooldownMillis = 5000;
        // 每尝试多少个 nonce 检查一次取消标记
        private int cancelCheckInterval = 10_000;
    }

    @Data
    public static class Genesis {
        private long time = 1_700_000_000L;
        private String address = "0000000000000000000000000000000000000000";
        // 可选：期望的创世区块哈希，为空则不校验
        private String expectedHash;
    }
}
