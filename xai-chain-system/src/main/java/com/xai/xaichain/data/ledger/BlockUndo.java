package com.xai.xaichain.data.ledger;

import com.xai.xaichain.data.transaction.UTXO;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 区块回滚数据：连接时被花费的输出、被修改前的发送者 nonce、本区块新增的发行量
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockUndo {

    private byte[] blockHash;

    private long height;

    private ArrayList<UTXO> spentOutputs = new ArrayList<>();

    private LinkedHashMap<String, Long> previousNonces = new LinkedHashMap<>();

    private long minted;

    public static BlockUndo from(byte[] blockHash, long height, List<UTXO> spent, Map<String, Long> previousNonces, long minted) {
        return new BlockUndo(blockHash, height, new ArrayList<>(spent), new LinkedHashMap<>(previousNonces), minted);
    }
}
