package com.xai.xaichain.ledger;

import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.TXInput;
import com.xai.xaichain.data.transaction.TXOutput;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.data.transaction.TransactionKind;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.exception.MissingOutpointException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 叠加在底层视图上的可写层：区块内按顺序应用交易，底层不受影响
 */
public class OverlayLedgerView implements LedgerView {

    private final LedgerView base;

    // 本层新增且尚未花费的输出
    private final Map<String, UTXO> created = new LinkedHashMap<>();

    // 本层花费掉的底层输出
    private final Map<String, UTXO> spentFromBase = new LinkedHashMap<>();

    // 按花费顺序记录的全部被花费输出（含本层新增后又被花费的）
    private final List<UTXO> spentInOrder = new ArrayList<>();

    private final Map<String, Long> nonces = new LinkedHashMap<>();

    public OverlayLedgerView(LedgerView base) {
        this.base = base;
    }

    @Override
    public UTXO getUtxo(Outpoint outpoint) {
        String key = outpoint.toKeyHex();
        UTXO utxo = created.get(key);
        if (utxo != null) {
            return utxo;
        }
        if (spentFromBase.containsKey(key)) {
            return null;
        }
        return base.getUtxo(outpoint);
    }

    @Override
    public long getNonce(String address) {
        Long nonce = nonces.get(address);
        return nonce != null ? nonce : base.getNonce(address);
    }

    /**
     * 花费一个输出
     * @throws MissingOutpointException 输出不存在或已在本层花费
     */
    public UTXO spend(Outpoint outpoint) {
        String key = outpoint.toKeyHex();
        UTXO utxo = created.remove(key);
        if (utxo == null) {
            if (spentFromBase.containsKey(key)) {
                throw new MissingOutpointException(outpoint);
            }
            utxo = base.getUtxo(outpoint);
            if (utxo == null) {
                throw new MissingOutpointException(outpoint);
            }
            spentFromBase.put(key, utxo);
        }
        spentInOrder.add(utxo);
        return utxo;
    }

    /**
     * 新增一个输出；若同一输出之前在本层被花费（回滚场景）则恢复它
     */
    public void add(UTXO utxo) {
        String key = utxo.getOutpoint().toKeyHex();
        if (spentFromBase.remove(key) != null) {
            return;
        }
        created.put(key, utxo);
    }

    /**
     * 在本层应用一笔交易：花费输入、创建输出、推进账户 nonce
     * @return 输入金额合计
     * @throws ArithmeticException 输入金额溢出
     */
    public long applyTransaction(Transaction tx, long height) {
        long inputTotal = 0;
        for (TXInput input : tx.getInputs()) {
            inputTotal = Math.addExact(inputTotal, spend(input.toOutpoint()).getValue());
        }
        if (tx.getKind() == TransactionKind.ACCOUNT) {
            setNonce(tx.getSenderAddress(), tx.getNonce() + 1);
        }
        List<TXOutput> outputs = tx.getOutputs();
        for (int i = 0; i < outputs.size(); i++) {
            TXOutput output = outputs.get(i);
            add(new UTXO(tx.getTxId(), i, output.getAddress(), output.getValue(), height, tx.isCoinBase()));
        }
        return inputTotal;
    }

    public void setNonce(String address, long nextNonce) {
        nonces.put(address, nextNonce);
    }

    public Collection<UTXO> getCreated() {
        return created.values();
    }

    public Collection<UTXO> getSpentFromBase() {
        return spentFromBase.values();
    }

    public List<UTXO> getSpentInOrder() {
        return spentInOrder;
    }

    public Map<String, Long> getNonces() {
        return nonces;
    }
}
