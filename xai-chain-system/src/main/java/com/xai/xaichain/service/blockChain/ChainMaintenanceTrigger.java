package com.xai.xaichain.service.blockChain;

import com.xai.xaichain.exception.ChainException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 定期清理过期孤块与过期交易，没有新区块时也能及时回收
 */
@Slf4j
@Component
public class ChainMaintenanceTrigger {

    private final ConsensusEngine consensusEngine;
    private final int maintenanceIntervalSeconds;

    private ScheduledExecutorService scheduler;

    public ChainMaintenanceTrigger(ConsensusEngine consensusEngine,
                                   @Value("${system.maintenance-interval-seconds:60}") int maintenanceIntervalSeconds) {
        this.consensusEngine = consensusEngine;
        this.maintenanceIntervalSeconds = maintenanceIntervalSeconds;
    }

    @PostConstruct
    public void init() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "chain-maintenance-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::maintain, maintenanceIntervalSeconds, maintenanceIntervalSeconds, TimeUnit.SECONDS);
        log.info("链维护任务已启动，间隔 {} 秒", maintenanceIntervalSeconds);
    }

    void maintain() {
        if (consensusEngine.isHalted()) {
            return;
        }
        try {
            consensusEngine.runMaintenance();
        } catch (ChainException e) {
            log.error("链维护任务执行失败", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }
}
