package com.xai.xaichain.service.mining;

import com.xai.xaichain.consensus.pow.MiningCancellationToken;
import com.xai.xaichain.consensus.pow.ProofOfWorkSolver;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.BlockTemplate;
import com.xai.xaichain.data.block.TipChange;
import com.xai.xaichain.exception.ChainException;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.service.blockChain.ConsensusEngine;
import com.xai.xaichain.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static com.xai.xaichain.constant.BlockChainConstants.BLOCK_VERSION_1;

/**
 * 本地 CPU 挖矿：单线程循环 取模板 -> 求解 -> 提交
 * 链尖变化时共识引擎取消当前标记；接受其他节点区块后等待冷却期再开始
 */
@Slf4j
public class MiningService {

    private final ConsensusEngine engine;
    private final ProofOfWorkSolver solver;
    private final String minerAddress;

    //是否在挖矿 保证变量的可见性
    private volatile boolean mining = false;

    private volatile MiningCancellationToken currentToken;

    private ThreadPoolExecutor miningExecutor;

    public MiningService(ConsensusEngine engine, String minerAddress, int cancelCheckInterval) {
        this.engine = engine;
        this.minerAddress = minerAddress;
        this.solver = new ProofOfWorkSolver(cancelCheckInterval);
    }

    private void initMiningExecutor() {
        if (miningExecutor == null || miningExecutor.isShutdown() || miningExecutor.isTerminated()) {
            ThreadFactory threadFactory = r -> {
                Thread thread = new Thread(r, "mining-main-thread");
                thread.setPriority(Thread.NORM_PRIORITY);
                thread.setDaemon(false);
                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("挖矿线程[" + t.getName() + "]发生未捕获异常", e)
                );
                return thread;
            };
            // 挖矿任务串行执行，不缓存任务
            BlockingQueue<Runnable> workQueue = new SynchronousQueue<>();
            RejectedExecutionHandler rejectedHandler = (r, executor) ->
                    log.warn("挖矿线程池忙碌，无法提交新任务（当前任务可能正在执行或线程池已关闭）");
            miningExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    workQueue, threadFactory, rejectedHandler);
            miningExecutor.prestartCoreThread();
        }
    }

    /**
     * 启动挖矿
     * @return 已在挖矿返回 false
     */
    public synchronized boolean startMining() {
        if (mining) {
            log.warn("节点已经在挖矿");
            return false;
        }
        if (!CryptoUtil.isValidAddress(minerAddress)) {
            throw new IllegalStateException("矿工地址未配置或格式错误: " + minerAddress);
        }
        initMiningExecutor();
        mining = true;
        miningExecutor.execute(this::miningLoop);
        log.info("挖矿已启动，矿工地址 {}", minerAddress);
        return true;
    }

    private void miningLoop() {
        while (mining) {
            long cooldown = engine.miningCooldownRemainingMillis();
            if (cooldown > 0) {
                log.info("刚接受其他节点的区块，{} 毫秒后继续挖矿", cooldown);
                try {
                    Thread.sleep(Math.min(cooldown, 1000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                continue;
            }
            MiningCancellationToken token = engine.newMiningToken();
            currentToken = token;
            try {
                mineOnce(token);
            } catch (StorageFailureException e) {
                log.error("存储故障，停止挖矿", e);
                mining = false;
                return;
            } catch (ChainException e) {
                log.warn("挖出的区块被拒绝: {} {}", e.getReason(), e.getMessage());
            }
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
        }
    }

    /**
     * 在当前链尖上挖一个区块并提交
     * @return 提交后的链尖变化；被取消或 nonce 用尽返回 null
     */
    public TipChange mineOnce(MiningCancellationToken token) {
        BlockTemplate template = engine.getBlockTemplate(minerAddress);
        Block block = template.toBlock(BLOCK_VERSION_1);
        log.info("开始挖矿新区块 #{} (难度目标: {}, 交易数: {}, 手续费: {})", template.getHeight(),
                CryptoUtil.bytesToHex(template.getDifficultyTarget()), template.getTransactions().size() - 1,
                template.getTotalFees());
        ProofOfWorkSolver.MiningResult result = solver.solve(block.extractHeader(), token);
        if (!result.isFound()) {
            log.info("区块 #{} 未找到有效结果（{}），重新生成模板", template.getHeight(),
                    result.isCancelled() ? token.getReason() : "nonce 用尽");
            return null;
        }
        block.setNonce(result.getNonce());
        block.setHash(result.getHash());
        log.info("挖矿成功 #{} nonce={} 尝试 {} 次，提交区块 {}", template.getHeight(), result.getNonce(),
                result.getAttempts(), block.getHashHex());
        return engine.submitMinedBlock(block);
    }

    /**
     * 停止挖矿，当前任务在下一次检查取消标记时退出
     */
    public synchronized void stopMining() {
        if (!mining) {
            return;
        }
        mining = false;
        MiningCancellationToken token = currentToken;
        if (token != null) {
            token.cancel("停止挖矿");
        }
        log.info("挖矿已停止");
    }

    public boolean isMining() {
        return mining;
    }

    public void shutdown() {
        stopMining();
        if (miningExecutor != null) {
            miningExecutor.shutdown();
            try {
                if (!miningExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    miningExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                miningExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
