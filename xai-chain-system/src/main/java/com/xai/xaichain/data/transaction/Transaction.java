package com.xai.xaichain.data.transaction;

import com.xai.xaichain.constant.BlockChainConstants;
import com.xai.xaichain.util.CodecUtils;
import com.xai.xaichain.util.CryptoUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.security.PrivateKey;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.xai.xaichain.constant.BlockChainConstants.*;

@Slf4j
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Transaction {

    /**
     * 交易ID（txid）：含签名的完整规范编码做双重SHA256，默克尔根因此同时承诺签名
     */
    private byte[] txId;

    /**
     * 交易版本
     */
    private int version = TRANSACTION_VERSION_1;

    /**
     * 交易种类
     */
    private TransactionKind kind = TransactionKind.UTXO;

    /**
     * 交易输入
     */
    private List<TXInput> inputs = new ArrayList<>();

    /**
     * 交易输出
     */
    private List<TXOutput> outputs = new ArrayList<>();

    /**
     * 账户交易：发送者顺序 nonce；CoinBase：区块高度；UTXO 交易：0
     */
    private long nonce;

    /**
     * 创建时间（秒）
     */
    private long timestamp;


    // ------------------------------ ID 与签名 ------------------------------

    public byte[] calculateTxId() {
        return CryptoUtil.doubleSHA256(serialize());
    }

    /**
     * 重新计算并设置 txId
     */
    public Transaction refreshTxId() {
        this.txId = calculateTxId();
        return this;
    }

    public String getTxIdHex() {
        return CryptoUtil.bytesToHex(txId);
    }

    /**
     * 签名载荷：签名字段写为空的规范编码
     */
    public byte[] serializeUnsigned() {
        return serialize(false);
    }

    /**
     * 用同一把私钥为所有输入签名（所有输入属于同一地址）
     * @param privateKey 私钥
     * @param publicKey X.509 编码的公钥，会写入每个输入
     */
    public Transaction signAll(PrivateKey privateKey, byte[] publicKey) {
        for (TXInput input : inputs) {
            input.setPublicKey(publicKey);
            input.setSignature(null);
        }
        byte[] payload = serializeUnsigned();
        byte[] signature = CryptoUtil.ECDSASigner.applySignature(privateKey, payload);
        for (TXInput input : inputs) {
            input.setSignature(signature);
        }
        return refreshTxId();
    }


    // ------------------------------ 序列化：严格遵循规范格式 ------------------------------

    /**
     * 完整规范编码（含签名），用于传输、存储和计算大小
     */
    public byte[] serialize() {
        return serialize(true);
    }

    /**
     * 格式：版本号（4字节小端）→ 种类（1字节）→ 输入数量（VarInt）→ 输入列表 → 输出数量（VarInt）→ 输出列表 → nonce（8字节小端）→ 时间（8字节小端）
     */
    private byte[] serialize(boolean withSignatures) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            writeTo(dos, withSignatures);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("交易序列化失败", e);
        }
    }

    public void writeTo(DataOutputStream dos) throws IOException {
        writeTo(dos, true);
    }

    private void writeTo(DataOutputStream dos, boolean withSignatures) throws IOException {
        CodecUtils.writeIntLE(dos, version);
        dos.writeByte(kind.getCode());

        CodecUtils.writeVarInt(dos, inputs.size());
        for (TXInput input : inputs) {
            byte[] prevTxId = input.getTxId();
            // 前序交易ID固定32字节，空ID填0
            dos.write(prevTxId != null ? Arrays.copyOf(prevTxId, 32) : new byte[32]);
            CodecUtils.writeIntLE(dos, input.getVout());
            CodecUtils.writeIntLE(dos, (int) input.getSequence());
            CodecUtils.writeBytes(dos, input.getPublicKey());
            CodecUtils.writeBytes(dos, withSignatures ? input.getSignature() : null);
        }

        CodecUtils.writeVarInt(dos, outputs.size());
        for (TXOutput output : outputs) {
            CodecUtils.writeLongLE(dos, output.getValue());
            CodecUtils.writeString(dos, output.getAddress());
        }

        CodecUtils.writeLongLE(dos, nonce);
        CodecUtils.writeLongLE(dos, timestamp);
    }

    public static Transaction deserialize(byte[] bytes) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(bytes))) {
            Transaction tx = readFrom(dis);
            if (dis.available() > 0) {
                throw new IOException("交易末尾存在多余字节");
            }
            return tx;
        } catch (IOException e) {
            throw CodecUtils.malformed("交易", e);
        }
    }

    /**
     * 从流中读出一笔交易并计算 txId
     */
    public static Transaction readFrom(DataInputStream dis) throws IOException {
        Transaction tx = new Transaction();
        tx.setVersion(CodecUtils.readIntLE(dis));
        tx.setKind(TransactionKind.fromCode(dis.readUnsignedByte()));

        int inputCount = CodecUtils.readCount(dis, MAX_TX_IO_COUNT, "输入");
        List<TXInput> inputs = new ArrayList<>(inputCount);
        for (int i = 0; i < inputCount; i++) {
            TXInput input = new TXInput();
            byte[] prevTxId = new byte[32];
            dis.readFully(prevTxId);
            input.setTxId(prevTxId);
            input.setVout(CodecUtils.readIntLE(dis));
            input.setSequence(CodecUtils.readIntLE(dis) & 0xFFFFFFFFL);
            input.setPublicKey(CodecUtils.readBytes(dis, MAX_PUBLIC_KEY_SIZE));
            input.setSignature(CodecUtils.readBytes(dis, MAX_SIGNATURE_SIZE));
            inputs.add(input);
        }
        tx.setInputs(inputs);

        int outputCount = CodecUtils.readCount(dis, MAX_TX_IO_COUNT, "输出");
        List<TXOutput> outputs = new ArrayList<>(outputCount);
        for (int i = 0; i < outputCount; i++) {
            long value = CodecUtils.readLongLE(dis);
            String address = CodecUtils.readString(dis, MAX_ADDRESS_SIZE);
            outputs.add(new TXOutput(value, address));
        }
        tx.setOutputs(outputs);

        tx.setNonce(CodecUtils.readLongLE(dis));
        tx.setTimestamp(CodecUtils.readLongLE(dis));
        return tx.refreshTxId();
    }

    /**
     * 规范编码后的字节数
     */
    public int calculateSize() {
        return serialize().length;
    }


    // ------------------------------ 辅助 ------------------------------

    public boolean isCoinBase() {
        return kind == TransactionKind.COINBASE;
    }

    /**
     * 发送者地址：第一个输入的公钥对应的地址，CoinBase 没有发送者
     */
    public String getSenderAddress() {
        if (isCoinBase() || inputs.isEmpty() || inputs.get(0).getPublicKey() == null) {
            return null;
        }
        return CryptoUtil.publicKeyToAddress(inputs.get(0).getPublicKey());
    }

    /**
     * 任一输入的序列号低于阈值即声明可被替换（RBF）
     */
    public boolean isReplaceable() {
        for (TXInput input : inputs) {
            if (input.getSequence() < TXInput.RBF_SEQUENCE_THRESHOLD) {
                return true;
            }
        }
        return false;
    }

    public long totalOutputValue() {
        long total = 0;
        for (TXOutput output : outputs) {
            total = Math.addExact(total, output.getValue());
        }
        return total;
    }

    /**
     * 创建CoinBase交易
     * @param height 区块高度，写入 nonce 保证每个高度的 CoinBase 交易ID唯一
     */
    public static Transaction createCoinBaseTransaction(long height, String minerAddress, long amount, long time) {
        Transaction coinbase = new Transaction();
        coinbase.setVersion(BlockChainConstants.TRANSACTION_VERSION_1);
        coinbase.setKind(TransactionKind.COINBASE);
        coinbase.setInputs(new ArrayList<>());
        List<TXOutput> outputs = new ArrayList<>();
        outputs.add(new TXOutput(amount, minerAddress));
        coinbase.setOutputs(outputs);
        coinbase.setNonce(height);
        coinbase.setTimestamp(time);
        return coinbase.refreshTxId();
    }
}
