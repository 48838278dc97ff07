package com.xai.xaichain.config;

import com.xai.xaichain.exception.UnsupportedChainException;
import com.xai.xaichain.network.LoggingPeerReputationReporter;
import com.xai.xaichain.network.PeerReputationReporter;
import com.xai.xaichain.service.blockChain.ConsensusEngine;
import com.xai.xaichain.service.mining.MiningService;
import com.xai.xaichain.storage.ChainStore;
import com.xai.xaichain.storage.MemoryChainStore;
import com.xai.xaichain.storage.RocksDbChainStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(SystemConfig.class)
public class ChainBeanConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public ChainStore chainStore(SystemConfig systemConfig) {
        if ("memory".equalsIgnoreCase(systemConfig.getStorageType())) {
            log.info("使用内存存储，进程退出后数据丢失");
            return new MemoryChainStore();
        }
        return new RocksDbChainStore(systemConfig.getStoragePath());
    }

    @Bean
    public PeerReputationReporter peerReputationReporter() {
        return new LoggingPeerReputationReporter();
    }

    @Bean(destroyMethod = "close")
    public ConsensusEngine consensusEngine(SystemConfig systemConfig, ChainStore chainStore, Clock clock,
                                           PeerReputationReporter peerReputationReporter) throws UnsupportedChainException {
        ConsensusEngine engine = new ConsensusEngine(systemConfig, chainStore, clock, peerReputationReporter);
        engine.start();
        return engine;
    }

    @Bean(destroyMethod = "shutdown")
    public MiningService miningService(SystemConfig systemConfig, ConsensusEngine consensusEngine) {
        SystemConfig.Mining mining = systemConfig.getMining();
        MiningService miningService = new MiningService(consensusEngine, mining.getMinerAddress(), mining.getCancelCheckInterval());
        if (mining.isEnabled()) {
            miningService.startMining();
        }
        return miningService;
    }
}
