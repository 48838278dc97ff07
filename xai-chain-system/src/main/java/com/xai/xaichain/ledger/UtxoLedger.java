package com.xai.xaichain.ledger;

import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.ledger.BlockUndo;
import com.xai.xaichain.data.ledger.LedgerDelta;
import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.data.transaction.TransactionKind;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.exception.AmountOverflowException;
import com.xai.xaichain.exception.ConsensusViolationException;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.storage.ChainStore;
import com.xai.xaichain.storage.StoreBatch;
import com.xai.xaichain.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static com.xai.xaichain.constant.BlockChainConstants.MAX_SUPPLY;

/**
 * UTXO 账本：输出引用到未花费输出的权威映射
 * 区块的应用与回滚都在一个存储批次里提交，要么全部生效要么不生效；每次提交后状态版本递增
 */
@Slf4j
public class UtxoLedger implements LedgerView {

    private final ChainStore store;

    private final AtomicLong stateVersion = new AtomicLong();

    public UtxoLedger(ChainStore store) {
        this.store = store;
    }

    @Override
    public UTXO getUtxo(Outpoint outpoint) {
        return store.getUtxo(outpoint);
    }

    @Override
    public long getNonce(String address) {
        return store.getNonce(address);
    }

    public long getBalance(String address) {
        long balance = 0;
        try {
            for (UTXO utxo : store.getUtxosByAddress(address)) {
                balance = Math.addExact(balance, utxo.getValue());
            }
        } catch (ArithmeticException e) {
            throw new AmountOverflowException("余额累加溢出: " + address, e);
        }
        return balance;
    }

    public List<UTXO> getUtxos(String address) {
        return store.getUtxosByAddress(address);
    }

    public long getTotalSupply() {
        return store.getTotalSupply();
    }

    public long getUtxoCount() {
        return store.getUtxoCount();
    }

    public long getStateVersion() {
        return stateVersion.get();
    }

    /**
     * 应用区块：消耗引用的输出、创建新输出、推进账户 nonce，并写入回滚数据
     * @param extraWrites 与账本变更同批提交的其他写入（主链索引、交易索引、链尖）
     * @throws com.xai.xaichain.exception.MissingOutpointException 引用的输出不存在
     * @throws AmountOverflowException 金额溢出
     */
    public LedgerDelta applyBlock(Block block, long height, Consumer<StoreBatch> extraWrites) {
        OverlayLedgerView overlay = new OverlayLedgerView(this);
        Map<String, Long> previousNonces = new LinkedHashMap<>();
        long fees = 0;
        long coinbaseTotal = 0;
        try {
            for (Transaction tx : block.getTransactions()) {
                if (tx.getKind() == TransactionKind.ACCOUNT) {
                    String sender = tx.getSenderAddress();
                    previousNonces.putIfAbsent(sender, overlay.getNonce(sender));
                }
                long inputTotal = overlay.applyTransaction(tx, height);
                long outputTotal = tx.totalOutputValue();
                if (tx.isCoinBase()) {
                    coinbaseTotal = Math.addExact(coinbaseTotal, outputTotal);
                } else {
                    if (inputTotal < outputTotal) {
                        throw new ConsensusViolationException(RejectReason.INSUFFICIENT_FUNDS,
                                "交易输入不足以支付输出: " + tx.getTxIdHex());
                    }
                    fees = Math.addExact(fees, inputTotal - outputTotal);
                }
            }
        } catch (ArithmeticException e) {
            throw new AmountOverflowException("区块金额溢出: " + block.getHashHex(), e);
        }

        long minted = coinbaseTotal - fees;
        long totalSupply;
        try {
            totalSupply = Math.addExact(store.getTotalSupply(), minted);
        } catch (ArithmeticException e) {
            throw new AmountOverflowException("发行总量溢出", e);
        }
        if (minted < 0 || totalSupply > MAX_SUPPLY) {
            throw new ConsensusViolationException(RejectReason.BAD_COINBASE,
                    "区块发行量非法: minted=" + minted + " total=" + totalSupply);
        }

        BlockUndo undo = BlockUndo.from(block.getHash(), height, overlay.getSpentInOrder(), previousNonces, minted);
        long utxoCount = store.getUtxoCount() + overlay.getCreated().size() - overlay.getSpentFromBase().size();

        StoreBatch batch = store.newBatch();
        for (UTXO utxo : overlay.getSpentFromBase()) {
            batch.deleteUtxo(utxo);
        }
        for (UTXO utxo : overlay.getCreated()) {
            batch.putUtxo(utxo);
        }
        for (Map.Entry<String, Long> entry : overlay.getNonces().entrySet()) {
            batch.putNonce(entry.getKey(), entry.getValue());
        }
        batch.putUndo(undo)
                .putTotalSupply(totalSupply)
                .putUtxoCount(utxoCount);
        if (extraWrites != null) {
            extraWrites.accept(batch);
        }
        batch.commit();
        long version = stateVersion.incrementAndGet();
        log.debug("账本应用区块 高度:{} 哈希:{} 花费:{} 新增:{} 手续费:{} 新发行:{}",
                height, block.getHashHex(), overlay.getSpentInOrder().size(), overlay.getCreated().size(), fees, minted);

        return new LedgerDelta(block.getHash(), height,
                new ArrayList<>(overlay.getSpentInOrder()), new ArrayList<>(overlay.getCreated()),
                new LinkedHashMap<>(overlay.getNonces()), previousNonces, fees, minted, version);
    }

    /**
     * 回滚区块：删除区块创建的输出，恢复被花费的输出和账户 nonce
     * 必须按链的逆序逐个回滚，区块必须是当前账本最后应用的区块
     */
    public LedgerDelta revertBlock(Block block, long height, Consumer<StoreBatch> extraWrites) {
        BlockUndo undo = store.getUndo(block.getHash());
        if (undo == null) {
            throw new StorageFailureException("缺少区块回滚数据: " + block.getHashHex());
        }
        Map<String, UTXO> spentByKey = new HashMap<>();
        for (UTXO utxo : undo.getSpentOutputs()) {
            spentByKey.put(utxo.getOutpoint().toKeyHex(), utxo);
        }

        OverlayLedgerView overlay = new OverlayLedgerView(this);
        List<Transaction> transactions = block.getTransactions();
        for (int t = transactions.size() - 1; t >= 0; t--) {
            Transaction tx = transactions.get(t);
            for (int i = tx.getOutputs().size() - 1; i >= 0; i--) {
                overlay.spend(new Outpoint(tx.getTxId(), i));
            }
            for (int i = tx.getInputs().size() - 1; i >= 0; i--) {
                Outpoint outpoint = tx.getInputs().get(i).toOutpoint();
                UTXO restored = spentByKey.get(outpoint.toKeyHex());
                if (restored == null) {
                    throw new StorageFailureException("回滚数据缺少被花费的输出: " + outpoint);
                }
                overlay.add(restored);
            }
        }

        long totalSupply = store.getTotalSupply() - undo.getMinted();
        // 回滚时 created 为恢复的输出，spentFromBase 为删除的输出
        long utxoCount = store.getUtxoCount() + overlay.getCreated().size() - overlay.getSpentFromBase().size();

        StoreBatch batch = store.newBatch();
        for (UTXO utxo : overlay.getSpentFromBase()) {
            batch.deleteUtxo(utxo);
        }
        for (UTXO utxo : overlay.getCreated()) {
            batch.putUtxo(utxo);
        }
        Map<String, Long> currentNonces = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : undo.getPreviousNonces().entrySet()) {
            currentNonces.put(entry.getKey(), store.getNonce(entry.getKey()));
            batch.putNonce(entry.getKey(), entry.getValue());
        }
        batch.deleteUndo(block.getHash())
                .putTotalSupply(totalSupply)
                .putUtxoCount(utxoCount);
        if (extraWrites != null) {
            extraWrites.accept(batch);
        }
        batch.commit();
        long version = stateVersion.incrementAndGet();
        log.debug("账本回滚区块 高度:{} 哈希:{}", height, CryptoUtil.bytesToHex(block.getHash()));

        return new LedgerDelta(block.getHash(), height,
                new ArrayList<>(overlay.getSpentFromBase()), new ArrayList<>(overlay.getCreated()),
                new LinkedHashMap<>(undo.getPreviousNonces()), currentNonces, 0, -undo.getMinted(), version);
    }
}
