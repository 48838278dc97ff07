package com.xai.xaichain.validation;

import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.exception.AmountOverflowException;
import com.xai.xaichain.exception.ConsensusViolationException;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.ledger.LedgerView;
import com.xai.xaichain.ledger.OverlayLedgerView;
import com.xai.xaichain.util.CryptoUtil;
import com.xai.xaichain.util.DifficultyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.xai.xaichain.constant.BlockChainConstants.BLOCK_VERSION_1;
import static com.xai.xaichain.constant.BlockChainConstants.MAX_BLOCK_TIME;

/**
 * 区块校验，各步骤按顺序调用，第一个失败即抛出
 * 结构 -> 工作量 -> 时间戳 ->（父区块，由引擎处理）-> 上下文 -> 默克尔根 -> 交易
 */
@Slf4j
public class BlockValidator {

    private final TransactionValidator transactionValidator;
    private final int maxBlockSize;
    private final int maxTransactionsPerBlock;
    private final long maxFutureDriftSeconds;
    private final BigInteger powLimit;

    public BlockValidator(TransactionValidator transactionValidator, int maxBlockSize, int maxTransactionsPerBlock,
                          long maxFutureDriftSeconds, BigInteger powLimit) {
        this.transactionValidator = transactionValidator;
        this.maxBlockSize = maxBlockSize;
        this.maxTransactionsPerBlock = maxTransactionsPerBlock;
        this.maxFutureDriftSeconds = maxFutureDriftSeconds;
        this.powLimit = powLimit;
    }

    /**
     * (1) 结构：非空、大小、CoinBase 位置、重复交易、每笔交易的无状态检查
     */
    public void validateStructure(Block block) {
        List<Transaction> transactions = block.getTransactions();
        if (transactions == null || transactions.isEmpty()) {
            throw new ValidationException(RejectReason.MALFORMED, "区块不包含任何交易");
        }
        if (block.getVersion() != BLOCK_VERSION_1) {
            throw new ValidationException(RejectReason.MALFORMED, "不支持的区块版本: " + block.getVersion());
        }
        if (block.getTime() < 0 || block.getTime() > MAX_BLOCK_TIME) {
            throw new ValidationException(RejectReason.MALFORMED, "区块时间超出32位范围");
        }
        if (transactions.size() > maxTransactionsPerBlock) {
            throw new ValidationException(RejectReason.OVERSIZED, "区块交易数 " + transactions.size() + " 超过上限");
        }
        int size = block.calculateSize();
        if (size > maxBlockSize) {
            throw new ValidationException(RejectReason.OVERSIZED, "区块大小 " + size + " 超过上限 " + maxBlockSize);
        }
        if (!transactions.get(0).isCoinBase()) {
            throw new ConsensusViolationException(RejectReason.BAD_COINBASE, "区块第一笔交易必须是CoinBase");
        }
        Set<String> txIds = new HashSet<>();
        for (int i = 0; i < transactions.size(); i++) {
            Transaction tx = transactions.get(i);
            if (i > 0 && tx.isCoinBase()) {
                throw new ConsensusViolationException(RejectReason.BAD_COINBASE, "CoinBase交易只能出现在区块首位");
            }
            transactionValidator.validateStateless(tx);
            if (!txIds.add(tx.getTxIdHex())) {
                throw new ConsensusViolationException(RejectReason.DUPLICATE_TX_IN_BLOCK, "区块内重复交易: " + tx.getTxIdHex());
            }
        }
    }

    /**
     * (2) 工作量证明：哈希与区块头一致，且不大于区块声明的难度目标，目标不超过最低难度
     */
    public void validateProofOfWork(Block block) {
        byte[] computed = block.computeHash();
        if (block.getHash() != null && !Arrays.equals(computed, block.getHash())) {
            throw new ConsensusViolationException(RejectReason.BAD_HASH,
                    "区块头哈希不匹配，计算出的哈希：" + CryptoUtil.bytesToHex(computed));
        }
        BigInteger target;
        try {
            target = DifficultyUtils.compactToTarget(block.getDifficultyTarget());
        } catch (IllegalArgumentException e) {
            throw new ConsensusViolationException(RejectReason.BAD_DIFFICULTY, "难度目标格式错误", e);
        }
        if (target.compareTo(powLimit) > 0) {
            throw new ConsensusViolationException(RejectReason.BAD_DIFFICULTY, "难度目标低于网络最低难度");
        }
        if (!block.validatePoW()) {
            throw new ConsensusViolationException(RejectReason.BAD_POW,
                    "区块 PoW 验证失败，哈希：" + CryptoUtil.bytesToHex(computed));
        }
    }

    /**
     * (3) 时间戳不能超前本地时间太多；超前的区块直接拒绝，不进入孤块池
     */
    public void validateFutureDrift(Block block, long nowSeconds) {
        long maxAllowedTime = nowSeconds + maxFutureDriftSeconds;
        if (block.getTime() > maxAllowedTime) {
            throw new ConsensusViolationException(RejectReason.TIME_TOO_NEW,
                    "区块时间戳超前过多，区块时间：" + block.getTime() + "，允许的最大时间：" + maxAllowedTime);
        }
    }

    /**
     * (4) 上下文：中位时间、期望难度、受信任检查点
     * @param trustedHash 该高度配置的受信任哈希，没有为 null
     */
    public void validateContext(Block block, long height, long medianTimePast, byte[] expectedBits, byte[] trustedHash) {
        if (block.getTime() < medianTimePast) {
            throw new ConsensusViolationException(RejectReason.TIME_TOO_OLD,
                    "区块时间 " + block.getTime() + " 早于中位时间 " + medianTimePast);
        }
        if (!Arrays.equals(block.getDifficultyTarget(), expectedBits)) {
            throw new ConsensusViolationException(RejectReason.BAD_DIFFICULTY,
                    "难度目标 " + CryptoUtil.bytesToHex(block.getDifficultyTarget()) + " 期望 " + CryptoUtil.bytesToHex(expectedBits));
        }
        if (trustedHash != null && !Arrays.equals(trustedHash, block.computeHash())) {
            throw new ConsensusViolationException(RejectReason.CHECKPOINT_MISMATCH,
                    "高度 " + height + " 的区块与受信任检查点不一致");
        }
    }

    /**
     * (5) 默克尔根与交易重新计算的结果一致
     */
    public void validateMerkleRoot(Block block) {
        byte[] computed = Block.calculateMerkleRoot(block.getTransactions());
        if (!Arrays.equals(computed, block.getMerkleRoot())) {
            throw new ConsensusViolationException(RejectReason.BAD_MERKLE_ROOT,
                    "默克尔根不匹配，计算值：" + CryptoUtil.bytesToHex(computed));
        }
    }

    /**
     * (6)(7) 在父区块状态上按区块内顺序逐笔校验并叠加，最后校验 CoinBase 金额
     * @param parentState 父区块之后的账本状态
     * @param reward 该高度的区块奖励
     * @return 区块手续费合计
     */
    public long validateTransactions(Block block, long height, LedgerView parentState, long reward) {
        OverlayLedgerView overlay = new OverlayLedgerView(parentState);
        List<Transaction> transactions = block.getTransactions();
        Transaction coinbase = transactions.get(0);
        if (coinbase.getNonce() != height) {
            throw new ConsensusViolationException(RejectReason.BAD_COINBASE,
                    "CoinBase nonce " + coinbase.getNonce() + " 与高度 " + height + " 不一致");
        }
        overlay.applyTransaction(coinbase, height);

        long fees = 0;
        for (int i = 1; i < transactions.size(); i++) {
            Transaction tx = transactions.get(i);
            TxValidationResult result = transactionValidator.validateStateful(tx, overlay, height);
            if (result.isFutureNonce()) {
                throw new ConsensusViolationException(RejectReason.FUTURE_NONCE_IN_BLOCK,
                        "区块内交易 " + tx.getTxIdHex() + " " + result.getMessage());
            }
            if (!result.isValid()) {
                log.warn("区块 {} 中的交易 {} 校验失败: {}", block.getHashHex(), tx.getTxIdHex(), result);
                throw result.toException();
            }
            overlay.applyTransaction(tx, height);
            fees = addAmount(fees, result.getFee());
        }

        long coinbaseTotal = coinbase.totalOutputValue();
        long allowed = addAmount(reward, fees);
        if (coinbaseTotal > allowed) {
            throw new ConsensusViolationException(RejectReason.BAD_COINBASE,
                    "CoinBase输出 " + coinbaseTotal + " 超过奖励加手续费 " + allowed);
        }
        return fees;
    }

    private static long addAmount(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new AmountOverflowException("区块手续费累加溢出", e);
        }
    }
}
