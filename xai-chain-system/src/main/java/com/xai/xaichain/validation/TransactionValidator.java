package com.xai.xaichain.validation;

import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.TXInput;
import com.xai.xaichain.data.transaction.TXOutput;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.ledger.LedgerView;
import com.xai.xaichain.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.xai.xaichain.constant.BlockChainConstants.*;

/**
 * 交易校验
 * 无状态检查只看交易本身；有状态检查依赖账本视图，按交易种类分派
 */
@Slf4j
public class TransactionValidator {

    private final int maxTransactionSize;
    private final int coinbaseMaturity;
    private final int futureNonceWindow;

    public TransactionValidator(int maxTransactionSize, int coinbaseMaturity, int futureNonceWindow) {
        this.maxTransactionSize = maxTransactionSize;
        this.coinbaseMaturity = coinbaseMaturity;
        this.futureNonceWindow = futureNonceWindow;
    }

    // ------------------------------ 无状态 ------------------------------

    /**
     * 无状态检查：结构、大小、重复输入、签名格式、地址、金额、交易ID
     * @throws ValidationException 第一个不满足的条件
     */
    public void validateStateless(Transaction tx) {
        if (tx == null || tx.getKind() == null || tx.getInputs() == null || tx.getOutputs() == null) {
            throw new ValidationException(RejectReason.MALFORMED, "交易字段缺失");
        }
        if (tx.getVersion() != TRANSACTION_VERSION_1) {
            throw new ValidationException(RejectReason.MALFORMED, "不支持的交易版本: " + tx.getVersion());
        }
        validateSize(tx);
        switch (tx.getKind()) {
            case COINBASE:
                validateCoinbaseStructure(tx);
                break;
            case UTXO:
                validateSpendStructure(tx);
                if (tx.getNonce() != 0) {
                    throw new ValidationException(RejectReason.BAD_NONCE_FIELD, "UTXO交易的nonce必须为0");
                }
                break;
            case ACCOUNT:
                validateSpendStructure(tx);
                validateSingleSender(tx);
                if (tx.getNonce() < 0) {
                    throw new ValidationException(RejectReason.BAD_NONCE_FIELD, "账户交易nonce不能为负");
                }
                break;
            default:
                throw new ValidationException(RejectReason.MALFORMED, "未知交易种类: " + tx.getKind());
        }
        validateTransactionId(tx);
    }

    private void validateSize(Transaction tx) {
        if (tx.getInputs().size() > MAX_TX_IO_COUNT || tx.getOutputs().size() > MAX_TX_IO_COUNT) {
            throw new ValidationException(RejectReason.OVERSIZED, "交易输入或输出数量过多");
        }
        int size = tx.calculateSize();
        if (size > maxTransactionSize) {
            throw new ValidationException(RejectReason.OVERSIZED, "交易大小 " + size + " 超过上限 " + maxTransactionSize);
        }
    }

    private void validateCoinbaseStructure(Transaction tx) {
        if (!tx.getInputs().isEmpty()) {
            throw new ValidationException(RejectReason.MALFORMED, "CoinBase交易不能有输入");
        }
        if (tx.getOutputs().isEmpty()) {
            throw new ValidationException(RejectReason.EMPTY_OUTPUTS, "CoinBase交易输出为空");
        }
        // CoinBase 允许 0 金额输出
        validateOutputs(tx.getOutputs(), 0);
    }

    private void validateSpendStructure(Transaction tx) {
        if (tx.getInputs().isEmpty()) {
            throw new ValidationException(RejectReason.EMPTY_INPUTS, "交易输入为空");
        }
        if (tx.getOutputs().isEmpty()) {
            throw new ValidationException(RejectReason.EMPTY_OUTPUTS, "交易输出为空");
        }
        Set<String> seen = new HashSet<>();
        for (TXInput input : tx.getInputs()) {
            if (input.getTxId() == null || input.getTxId().length != 32 || input.getVout() < 0) {
                throw new ValidationException(RejectReason.MALFORMED, "输入引用格式错误");
            }
            if (!seen.add(input.toOutpoint().toKeyHex())) {
                throw new ValidationException(RejectReason.DUPLICATE_INPUT, "重复的输入: " + input.toOutpoint());
            }
            validateSignatureFormat(input);
        }
        validateOutputs(tx.getOutputs(), 1);
    }

    private void validateSignatureFormat(TXInput input) {
        byte[] publicKey = input.getPublicKey();
        byte[] signature = input.getSignature();
        if (publicKey == null || publicKey.length == 0 || publicKey.length > MAX_PUBLIC_KEY_SIZE) {
            throw new ValidationException(RejectReason.BAD_SIGNATURE_FORMAT, "公钥缺失或长度非法");
        }
        // DER 编码的 ECDSA 签名至少 8 字节
        if (signature == null || signature.length < 8 || signature.length > MAX_SIGNATURE_SIZE) {
            throw new ValidationException(RejectReason.BAD_SIGNATURE_FORMAT, "签名缺失或长度非法");
        }
        try {
            CryptoUtil.ECDSASigner.bytesToPublicKey(publicKey);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(RejectReason.BAD_SIGNATURE_FORMAT, "公钥无法解析", e);
        }
    }

    private void validateOutputs(List<TXOutput> outputs, long minValue) {
        long total = 0;
        for (TXOutput output : outputs) {
            if (output.getValue() < minValue || output.getValue() > MAX_SUPPLY) {
                throw new ValidationException(RejectReason.BAD_AMOUNT, "输出金额非法: " + output.getValue());
            }
            if (!CryptoUtil.isValidAddress(output.getAddress())) {
                throw new ValidationException(RejectReason.BAD_ADDRESS, "输出地址非法: " + output.getAddress());
            }
            total += output.getValue();
            if (total > MAX_SUPPLY) {
                throw new ValidationException(RejectReason.BAD_AMOUNT, "输出金额合计超过发行上限");
            }
        }
    }

    private void validateSingleSender(Transaction tx) {
        byte[] first = tx.getInputs().get(0).getPublicKey();
        for (TXInput input : tx.getInputs()) {
            if (!Arrays.equals(first, input.getPublicKey())) {
                throw new ValidationException(RejectReason.MIXED_SENDERS, "账户交易的所有输入必须属于同一发送者");
            }
        }
    }

    private void validateTransactionId(Transaction tx) {
        if (tx.getTxId() == null || !Arrays.equals(tx.getTxId(), tx.calculateTxId())) {
            throw new ValidationException(RejectReason.BAD_TXID, "交易ID与内容不匹配");
        }
    }

    // ------------------------------ 有状态 ------------------------------

    /**
     * 有状态检查
     * @param view 账本视图（主链状态、区块内叠加层或交易池视图）
     * @param spendHeight 交易将被打包的高度，用于 CoinBase 成熟度
     */
    public TxValidationResult validateStateful(Transaction tx, LedgerView view, long spendHeight) {
        switch (tx.getKind()) {
            case COINBASE:
                return TxValidationResult.invalid(RejectReason.COINBASE_NOT_ALLOWED, "CoinBase交易只能出现在区块首位");
            case UTXO:
                return validateInputs(tx, view, spendHeight);
            case ACCOUNT:
                TxValidationResult nonceResult = validateNonce(tx, view);
                if (nonceResult != null) {
                    return nonceResult;
                }
                return validateInputs(tx, view, spendHeight);
            default:
                return TxValidationResult.invalid(RejectReason.MALFORMED, "未知交易种类: " + tx.getKind());
        }
    }

    /**
     * 账户 nonce 必须等于下一个期望值；窗口内的超前 nonce 返回 FUTURE_NONCE，通过返回 null
     */
    private TxValidationResult validateNonce(Transaction tx, LedgerView view) {
        String sender = tx.getSenderAddress();
        long expected = view.getNonce(sender);
        long actual = tx.getNonce();
        if (actual < expected) {
            return TxValidationResult.invalid(RejectReason.NONCE_REUSED,
                    "nonce已被使用，期望 " + expected + " 实际 " + actual);
        }
        if (actual > expected) {
            if (actual - expected <= futureNonceWindow) {
                return TxValidationResult.futureNonce(expected, actual);
            }
            return TxValidationResult.invalid(RejectReason.NONCE_TOO_FAR,
                    "nonce超出窗口，期望 " + expected + " 实际 " + actual);
        }
        return null;
    }

    private TxValidationResult validateInputs(Transaction tx, LedgerView view, long spendHeight) {
        byte[] payload = tx.serializeUnsigned();
        Set<String> verified = new HashSet<>();
        long inputTotal = 0;
        for (TXInput input : tx.getInputs()) {
            Outpoint outpoint = input.toOutpoint();
            UTXO utxo = view.getUtxo(outpoint);
            if (utxo == null) {
                return TxValidationResult.missing(outpoint);
            }
            if (utxo.isCoinbase() && spendHeight - utxo.getHeight() < coinbaseMaturity) {
                return TxValidationResult.invalid(RejectReason.IMMATURE_COINBASE,
                        "CoinBase输出 " + outpoint + " 需要 " + coinbaseMaturity + " 个确认");
            }
            if (!CryptoUtil.publicKeyToAddress(input.getPublicKey()).equals(utxo.getAddress())) {
                return TxValidationResult.invalid(RejectReason.OWNER_MISMATCH, "输入公钥不属于输出 " + outpoint + " 的所有者");
            }
            // 同一公钥与签名只验证一次
            String signatureKey = CryptoUtil.bytesToHex(input.getPublicKey()) + CryptoUtil.bytesToHex(input.getSignature());
            if (verified.add(signatureKey)
                    && !CryptoUtil.ECDSASigner.verifySignature(input.getPublicKey(), payload, input.getSignature())) {
                return TxValidationResult.invalid(RejectReason.BAD_SIGNATURE, "输入 " + outpoint + " 签名验证失败");
            }
            try {
                inputTotal = Math.addExact(inputTotal, utxo.getValue());
            } catch (ArithmeticException e) {
                return TxValidationResult.invalid(RejectReason.AMOUNT_OVERFLOW, "输入金额溢出");
            }
        }
        long outputTotal = tx.totalOutputValue();
        if (inputTotal < outputTotal) {
            return TxValidationResult.invalid(RejectReason.INSUFFICIENT_FUNDS,
                    "输入 " + inputTotal + " 小于输出 " + outputTotal);
        }
        long fee = inputTotal - outputTotal;
        log.debug("交易 {} 有状态校验通过，手续费 {}", tx.getTxIdHex(), fee);
        return TxValidationResult.valid(fee);
    }
}
