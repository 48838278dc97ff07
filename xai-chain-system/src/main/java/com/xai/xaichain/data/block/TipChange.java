package com.xai.xaichain.data.block;

import com.xai.xaichain.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * applyExternalBlock / submitMinedBlock 的结果
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TipChange {

    private TipChangeType type;

    private ChainTip oldTip;

    private ChainTip newTip;

    // 按应用顺序连接到主链的区块
    private List<Block> connectedBlocks = new ArrayList<>();

    // 按回滚顺序（从旧链尖往下）断开的区块
    private List<Block> disconnectedBlocks = new ArrayList<>();

    public static TipChange unchanged(TipChangeType type, ChainTip tip) {
        return new TipChange(type, tip, tip, new ArrayList<>(), new ArrayList<>());
    }

    public boolean isTipChanged() {
        return type == TipChangeType.EXTENDED || type == TipChangeType.REORG;
    }

    /**
     * 被断开区块中的非CoinBase交易，按原链顺序
     */
    public List<Transaction> getDisconnectedTransactions() {
        List<Transaction> result = new ArrayList<>();
        for (int i = disconnectedBlocks.size() - 1; i >= 0; i--) {
            for (Transaction tx : disconnectedBlocks.get(i).getTransactions()) {
                if (!tx.isCoinBase()) {
                    result.add(tx);
                }
            }
        }
        return result;
    }
}
