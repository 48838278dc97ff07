package com.xai.xaichain.data.block;

import com.xai.xaichain.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 挖矿模板：父区块、难度目标、按手续费率排序的交易（第一笔为CoinBase）
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockTemplate {

    private long height;

    private byte[] previousHash;

    private byte[] difficultyTarget;

    private long time;

    private long totalFees;

    private long reward;

    private List<Transaction> transactions = new ArrayList<>();

    /**
     * 生成待求解的区块（nonce 为 0，hash 未计算）
     */
    public Block toBlock(int version) {
        Block block = new Block();
        block.setHeight(height);
        block.setVersion(version);
        block.setPreviousHash(previousHash);
        block.setTime(time);
        block.setDifficultyTarget(difficultyTarget);
        block.setNonce(0);
        block.setTransactions(new ArrayList<>(transactions));
        block.calculateAndSetMerkleRoot();
        return block;
    }
}
