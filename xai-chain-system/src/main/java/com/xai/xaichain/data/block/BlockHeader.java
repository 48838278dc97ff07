package com.xai.xaichain.data.block;

import com.xai.xaichain.util.ByteUtils;
import com.xai.xaichain.util.CodecUtils;
import com.xai.xaichain.util.CryptoUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

import static com.xai.xaichain.constant.BlockChainConstants.MAX_BLOCK_TIME;

/**
 * 区块头。height 与 hash 只是随附信息，不参与序列化
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockHeader {

    private int version;

    private byte[] previousHash;

    private byte[] merkleRoot;

    private long time;

    private byte[] difficultyTarget;

    private int nonce;

    private long height;

    private byte[] hash;

    /**
     * 计算区块头哈希：双SHA-256后调整为小端字节序
     */
    public byte[] computeHash() {
        return ByteUtils.reverseBytes(CryptoUtil.doubleSHA256(serialize()));
    }

    /**
     * 序列化区块头
     * 字段顺序：version(4字节) → previousHash(32字节) → merkleRoot(32字节) → time(4字节) → difficultyBits(4字节) → nonce(4字节)
     * 所有数值字段采用小端字节序（Little-Endian）
     */
    public byte[] serialize() {
        if (previousHash == null || previousHash.length != 32) {
            throw new IllegalArgumentException("前区块哈希必须为32字节");
        }
        if (merkleRoot == null || merkleRoot.length != 32) {
            throw new IllegalArgumentException("默克尔根必须为32字节");
        }
        if (difficultyTarget == null || difficultyTarget.length != 4) {
            throw new IllegalArgumentException("难度目标必须为4字节");
        }
        if (time < 0 || time > MAX_BLOCK_TIME) {
            throw new IllegalArgumentException("时间戳必须为32位无符号秒");
        }
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream(80);
             DataOutputStream dos = new DataOutputStream(baos)) {
            CodecUtils.writeIntLE(dos, version);
            dos.write(ByteUtils.reverseBytes(previousHash));
            dos.write(ByteUtils.reverseBytes(merkleRoot));
            CodecUtils.writeIntLE(dos, (int) time);
            dos.write(ByteUtils.reverseBytes(difficultyTarget));
            CodecUtils.writeIntLE(dos, nonce);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("区块头序列化失败", e);
        }
    }

    public static BlockHeader deserialize(byte[] bytes) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(bytes))) {
            BlockHeader header = new BlockHeader();
            header.setVersion(CodecUtils.readIntLE(dis));
            byte[] prevHash = new byte[32];
            dis.readFully(prevHash);
            header.setPreviousHash(ByteUtils.reverseBytes(prevHash));
            byte[] merkleRoot = new byte[32];
            dis.readFully(merkleRoot);
            header.setMerkleRoot(ByteUtils.reverseBytes(merkleRoot));
            header.setTime(CodecUtils.readIntLE(dis) & 0xFFFFFFFFL);
            byte[] target = new byte[4];
            dis.readFully(target);
            header.setDifficultyTarget(ByteUtils.reverseBytes(target));
            header.setNonce(CodecUtils.readIntLE(dis));
            header.setHash(header.computeHash());
            return header;
        } catch (IOException e) {
            throw CodecUtils.malformed("区块头", e);
        }
    }
}
