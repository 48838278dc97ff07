package com.xai.xaichain.data.block;

import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.util.ByteUtils;
import com.xai.xaichain.util.CodecUtils;
import com.xai.xaichain.util.CryptoUtil;
import com.xai.xaichain.util.DifficultyUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.xai.xaichain.constant.BlockChainConstants.BLOCK_HEADER_SIZE;

@Slf4j
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Block {

    //区块高度，不参与哈希计算，由父区块推导
    private long height;
    //唯一的标识
    private byte[] hash;
    //前一个区块的哈希值
    private byte[] previousHash;
    //版本号
    private int version;
    //默克尔根
    private byte[] merkleRoot;
    //以秒为单位的 Unix 时间戳（32位无符号）
    private long time;
    //难度目标，4字节紧凑格式（nBits）
    private byte[] difficultyTarget;
    //随机数
    private int nonce;
    //区块中的交易，第一笔为CoinBase
    private List<Transaction> transactions = new ArrayList<>();

    // ------------------------------
    // 区块哈希与POW
    // ------------------------------

    /**
     * 计算区块哈希：区块头双SHA-256后反转字节序
     */
    public byte[] computeHash() {
        return extractHeader().computeHash();
    }

    /**
     * 计算并写入 hash 字段
     */
    public Block refreshHash() {
        this.hash = computeHash();
        return this;
    }

    public String getHashHex() {
        return CryptoUtil.bytesToHex(hash);
    }

    /**
     * 区块哈希是否满足自身的难度目标
     */
    public boolean validatePoW() {
        byte[] blockHash = computeHash();
        try {
            return DifficultyUtils.isValidHash(blockHash, difficultyTarget);
        } catch (IllegalArgumentException e) {
            log.warn("POW验证失败：{}", e.getMessage());
            return false;
        }
    }

    public BlockHeader extractHeader() {
        BlockHeader header = new BlockHeader();
        header.setVersion(this.version);
        header.setPreviousHash(this.previousHash);
        header.setMerkleRoot(this.merkleRoot);
        header.setTime(this.time);
        header.setDifficultyTarget(this.difficultyTarget);
        header.setNonce(this.nonce);
        header.setHeight(this.height);
        header.setHash(this.hash);
        return header;
    }

    // ------------------------------
    // 序列化：区块头 + 交易数量（VarInt）+ 交易列表
    // ------------------------------

    public byte[] serialize() {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            dos.write(extractHeader().serialize());
            CodecUtils.writeVarInt(dos, transactions.size());
            for (Transaction tx : transactions) {
                tx.writeTo(dos);
            }
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("区块序列化失败", e);
        }
    }

    /**
     * 从规范编码解析区块，hash 重新计算，height 由调用方根据父区块设置
     * @param maxTransactions 交易数量上限，防止恶意长度前缀
     */
    public static Block deserialize(byte[] bytes, int maxTransactions) {
        if (bytes == null || bytes.length < BLOCK_HEADER_SIZE) {
            throw CodecUtils.malformed("区块", new IOException("长度不足"));
        }
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(bytes))) {
            byte[] headerBytes = new byte[BLOCK_HEADER_SIZE];
            dis.readFully(headerBytes);
            BlockHeader header = BlockHeader.deserialize(headerBytes);
            int txCount = CodecUtils.readCount(dis, maxTransactions, "交易");
            List<Transaction> transactions = new ArrayList<>(txCount);
            for (int i = 0; i < txCount; i++) {
                transactions.add(Transaction.readFrom(dis));
            }
            if (dis.available() > 0) {
                throw new IOException("区块末尾存在多余字节");
            }
            Block block = merge(header, transactions);
            return block.refreshHash();
        } catch (IOException e) {
            throw CodecUtils.malformed("区块", e);
        }
    }

    /**
     * 从区块头和交易列表合并为完整区块
     */
    public static Block merge(BlockHeader header, List<Transaction> transactions) {
        Block block = new Block();
        block.setVersion(header.getVersion());
        block.setPreviousHash(header.getPreviousHash());
        block.setMerkleRoot(header.getMerkleRoot());
        block.setTime(header.getTime());
        block.setDifficultyTarget(header.getDifficultyTarget());
        block.setNonce(header.getNonce());
        block.setHeight(header.getHeight());
        block.setHash(header.getHash());
        block.setTransactions(new ArrayList<>(transactions));
        return block;
    }

    public int calculateSize() {
        return serialize().length;
    }

    // ------------------------------
    // 默克尔树（Merkle Tree）相关方法
    // ------------------------------

    /**
     * 计算并设置当前区块的默克尔根
     */
    public void calculateAndSetMerkleRoot() {
        this.merkleRoot = calculateMerkleRoot(this.transactions);
    }

    /**
     * 计算交易列表的默克尔根哈希
     * @param transactions 区块中的交易列表（空列表返回32字节零数组）
     */
    public static byte[] calculateMerkleRoot(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return new byte[32];
        }
        List<byte[]> leafHashes = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            leafHashes.add(tx.getTxId());
        }
        return calculateMerkleRootFromHashes(leafHashes);
    }

    /**
     * 逐层合并哈希对，每对拼接后做双SHA-256；奇数个时最后一个与自身合并
     */
    public static byte[] calculateMerkleRootFromHashes(List<byte[]> leafHashes) {
        if (leafHashes.isEmpty()) {
            return new byte[32];
        }
        List<byte[]> level = leafHashes;
        while (level.size() > 1) {
            level = nextLevel(level);
        }
        return level.get(0);
    }

    private static List<byte[]> nextLevel(List<byte[]> level) {
        List<byte[]> next = new ArrayList<>((level.size() + 1) / 2);
        for (int i = 0; i < level.size(); i += 2) {
            byte[] left = level.get(i);
            byte[] right = (i + 1 < level.size()) ? level.get(i + 1) : left;
            next.add(CryptoUtil.doubleSHA256(ByteUtils.concat(left, right)));
        }
        return next;
    }

    /**
     * 生成指定交易在当前区块中的默克尔路径
     * @param targetTxId 目标交易的txId
     * @return MerklePath对象，交易不存在则返回null
     */
    public MerklePath generateMerklePath(byte[] targetTxId) {
        if (transactions == null || transactions.isEmpty()) {
            log.warn("区块中无交易，无法生成默克尔路径");
            return null;
        }
        List<byte[]> level = new ArrayList<>(transactions.size());
        int index = -1;
        for (int i = 0; i < transactions.size(); i++) {
            byte[] txId = transactions.get(i).getTxId();
            level.add(txId);
            if (index < 0 && Arrays.equals(txId, targetTxId)) {
                index = i;
            }
        }
        if (index == -1) {
            log.warn("交易不在当前区块中，txId: {}", CryptoUtil.bytesToHex(targetTxId));
            return null;
        }

        List<byte[]> pathHashes = new ArrayList<>();
        int currentIndex = index;
        while (level.size() > 1) {
            int siblingIndex = (currentIndex % 2 == 0) ? currentIndex + 1 : currentIndex - 1;
            // 若兄弟节点不存在（当前层为奇数个节点），用当前节点哈希代替
            if (siblingIndex >= level.size()) {
                siblingIndex = currentIndex;
            }
            pathHashes.add(level.get(siblingIndex));
            level = nextLevel(level);
            currentIndex = currentIndex / 2;
        }
        return new MerklePath(pathHashes, index);
    }

    /**
     * 根据交易哈希、默克尔路径和索引计算默克尔根
     * @return 计算得到的默克尔根（32字节），参数非法返回null
     */
    public static byte[] calculateRootFromPath(byte[] transactionHash, List<byte[]> pathHashes, int index) {
        if (transactionHash == null || transactionHash.length != 32 || index < 0) {
            return null;
        }
        byte[] currentHash = transactionHash;
        int currentIndex = index;
        for (byte[] siblingHash : pathHashes) {
            if (siblingHash == null || siblingHash.length != 32) {
                return null;
            }
            if (currentIndex % 2 == 0) {
                currentHash = CryptoUtil.doubleSHA256(ByteUtils.concat(currentHash, siblingHash));
            } else {
                currentHash = CryptoUtil.doubleSHA256(ByteUtils.concat(siblingHash, currentHash));
            }
            currentIndex = currentIndex / 2;
        }
        // 索引超出树的宽度时路径不可能唯一对应该叶子
        if (currentIndex != 0) {
            return null;
        }
        return currentHash;
    }
}
