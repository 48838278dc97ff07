package com.xai.xaichain.event;

import com.xai.xaichain.data.block.ChainTip;
import com.xai.xaichain.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次重组：新旧链尖、分叉深度、放回交易池的交易
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ReorgEvent {

    private ChainTip oldTip;

    private ChainTip newTip;

    private long commonAncestorHeight;

    // 从旧链尖回滚的区块数
    private int depth;

    private int connectedCount;

    // 被断开区块中的非CoinBase交易
    private List<Transaction> disconnectedTransactions = new ArrayList<>();

    // 其中重新进入交易池的数量
    private int reinjectedCount;
}
