package com.xai.xaichain.data.block;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;

/**
 * SPV 轻客户端使用的交易包含证明
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class MerkleProof {

    private byte[] txId;

    private byte[] blockHash;

    private long height;

    private byte[] merkleRoot;

    private MerklePath path;

    /**
     * 只依赖区块头验证：由交易ID沿路径计算出的根必须等于区块头中的默克尔根
     */
    public boolean verify(BlockHeader header) {
        if (header == null || path == null || header.getMerkleRoot() == null) {
            return false;
        }
        if (blockHash != null && !Arrays.equals(header.computeHash(), blockHash)) {
            return false;
        }
        byte[] root = Block.calculateRootFromPath(txId, path.getPathHashes(), path.getIndex());
        return root != null && Arrays.equals(root, header.getMerkleRoot());
    }
}
