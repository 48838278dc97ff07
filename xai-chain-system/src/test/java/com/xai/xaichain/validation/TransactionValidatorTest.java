package com.xai.xaichain.validation;

import com.xai.xaichain.ChainFixture;
import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.TXInput;
import com.xai.xaichain.data.transaction.TXOutput;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.data.transaction.TransactionKind;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.ledger.LedgerView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.xai.xaichain.ChainFixture.fundingUtxo;
import static com.xai.xaichain.ChainFixture.pay;
import static com.xai.xaichain.ChainFixture.payWithNonce;

public class TransactionValidatorTest {

    private static final long HEIGHT = 50;

    private TransactionValidator validator;
    private TestView view;
    private ChainFixture.Wallet alice;
    private ChainFixture.Wallet bob;

    @BeforeEach
    public void setUp() {
        validator = new TransactionValidator(102_400, 100, 4);
        view = new TestView();
        alice = ChainFixture.newWallet();
        bob = ChainFixture.newWallet();
    }

    // ------------------------------ 无状态 ------------------------------

    @Test
    public void signedPaymentPassesStatelessChecks() {
        Transaction tx = pay(alice, fundingUtxo(alice.getAddress(), 1000), bob.getAddress(), 600, 100);
        validator.validateStateless(tx);
    }

    @Test
    public void paymentWithoutInputsIsRejected() {
        Transaction tx = new Transaction();
        tx.getOutputs().add(new TXOutput(10, bob.getAddress()));
        tx.refreshTxId();
        assertStateless(RejectReason.EMPTY_INPUTS, tx);
    }

    @Test
    public void badOutputAddressIsRejected() {
        Transaction tx = pay(alice, fundingUtxo(alice.getAddress(), 1000), "not-an-address", 600, 100);
        assertStateless(RejectReason.BAD_ADDRESS, tx);
    }

    @Test
    public void zeroValueOutputIsRejected() {
        Transaction tx = pay(alice, fundingUtxo(alice.getAddress(), 1000), bob.getAddress(), 0, 100);
        assertStateless(RejectReason.BAD_AMOUNT, tx);
    }

    @Test
    public void tamperedContentChangesTxId() {
        Transaction tx = pay(alice, fundingUtxo(alice.getAddress(), 1000), bob.getAddress(), 600, 100);
        tx.getOutputs().get(0).setValue(601);
        assertStateless(RejectReason.BAD_TXID, tx);
    }

    @Test
    public void utxoPaymentMustNotCarryNonce() {
        Transaction tx = ChainFixture.build(TransactionKind.UTXO, alice,
                Collections.singletonList(fundingUtxo(alice.getAddress(), 1000)),
                bob.getAddress(), 600, 100, 3, TXInput.FINAL_SEQUENCE);
        assertStateless(RejectReason.BAD_NONCE_FIELD, tx);
    }

    @Test
    public void duplicateInputIsRejected() {
        UTXO utxo = fundingUtxo(alice.getAddress(), 1000);
        Transaction tx = ChainFixture.build(TransactionKind.UTXO, alice, Arrays.asList(utxo, utxo),
                bob.getAddress(), 600, 100, 0, TXInput.FINAL_SEQUENCE);
        assertStateless(RejectReason.DUPLICATE_INPUT, tx);
    }

    @Test
    public void accountPaymentNeedsSingleSender() {
        UTXO fromAlice = fundingUtxo(alice.getAddress(), 1000);
        UTXO fromBob = fundingUtxo(bob.getAddress(), 1000);
        Transaction tx = ChainFixture.build(TransactionKind.ACCOUNT, alice, Arrays.asList(fromAlice, fromBob),
                bob.getAddress(), 600, 100, 0, TXInput.FINAL_SEQUENCE);
        // 第二个输入换成另一把公钥
        tx.getInputs().get(1).setPublicKey(bob.getPublicKey());
        assertStateless(RejectReason.MIXED_SENDERS, tx);
    }

    @Test
    public void missingSignatureIsRejected() {
        Transaction tx = pay(alice, fundingUtxo(alice.getAddress(), 1000), bob.getAddress(), 600, 100);
        tx.getInputs().get(0).setSignature(new byte[2]);
        assertStateless(RejectReason.BAD_SIGNATURE_FORMAT, tx);
    }

    // ------------------------------ 有状态 ------------------------------

    @Test
    public void feeIsInputsMinusOutputs() {
        UTXO utxo = view.fund(fundingUtxo(alice.getAddress(), 1000));
        Transaction tx = pay(alice, utxo, bob.getAddress(), 600, 150);
        TxValidationResult result = validator.validateStateful(tx, view, HEIGHT);
        Assertions.assertTrue(result.isValid(), result.toString());
        Assertions.assertEquals(150, result.getFee());
    }

    @Test
    public void unknownOutpointIsMissing() {
        UTXO utxo = fundingUtxo(alice.getAddress(), 1000);
        Transaction tx = pay(alice, utxo, bob.getAddress(), 600, 100);
        TxValidationResult result = validator.validateStateful(tx, view, HEIGHT);
        Assertions.assertEquals(RejectReason.MISSING_OUTPOINT, result.getReason());
        Assertions.assertEquals(utxo.getOutpoint(), result.getMissingOutpoint());
    }

    @Test
    public void spendingSomeoneElsesOutputIsRejected() {
        UTXO utxo = view.fund(fundingUtxo(bob.getAddress(), 1000));
        Transaction tx = pay(alice, utxo, alice.getAddress(), 600, 100);
        assertStateful(RejectReason.OWNER_MISMATCH, tx);
    }

    @Test
    public void signatureMustCoverOutputs() {
        UTXO utxo = view.fund(fundingUtxo(alice.getAddress(), 1000));
        Transaction tx = pay(alice, utxo, bob.getAddress(), 600, 100);
        tx.getOutputs().get(0).setAddress(alice.getAddress());
        tx.refreshTxId();
        validator.validateStateless(tx);
        assertStateful(RejectReason.BAD_SIGNATURE, tx);
    }

    @Test
    public void transactionIdCommitsToSignatures() {
        UTXO utxo = view.fund(fundingUtxo(alice.getAddress(), 1000));
        Transaction tx = pay(alice, utxo, bob.getAddress(), 600, 100);
        String signedId = tx.getTxIdHex();
        byte[] signature = tx.getInputs().get(0).getSignature();
        signature[signature.length - 1] ^= 1;
        assertStateless(RejectReason.BAD_TXID, tx);

        tx.refreshTxId();
        Assertions.assertNotEquals(signedId, tx.getTxIdHex());
        validator.validateStateless(tx);
        assertStateful(RejectReason.BAD_SIGNATURE, tx);
    }

    @Test
    public void overspendIsRejected() {
        UTXO utxo = view.fund(fundingUtxo(alice.getAddress(), 1000));
        Transaction tx = pay(alice, utxo, bob.getAddress(), 1001, 0);
        assertStateful(RejectReason.INSUFFICIENT_FUNDS, tx);
    }

    @Test
    public void coinbaseOutputsNeedMaturity() {
        UTXO young = new UTXO(new byte[32], 0, alice.getAddress(), 1000, HEIGHT - 99, true);
        view.fund(young);
        assertStateful(RejectReason.IMMATURE_COINBASE, pay(alice, young, bob.getAddress(), 600, 100));

        UTXO mature = new UTXO(new byte[32], 1, alice.getAddress(), 1000, HEIGHT - 100, true);
        view.fund(mature);
        Assertions.assertTrue(validator.validateStateful(pay(alice, mature, bob.getAddress(), 600, 100), view, HEIGHT)
                .isValid());
    }

    @Test
    public void accountNonceMustBeNext() {
        view.nonces.put(alice.getAddress(), 3L);
        UTXO utxo = view.fund(fundingUtxo(alice.getAddress(), 1000));

        assertStateful(RejectReason.NONCE_REUSED, payWithNonce(alice, utxo, bob.getAddress(), 600, 100, 2));
        Assertions.assertTrue(validator.validateStateful(payWithNonce(alice, utxo, bob.getAddress(), 600, 100, 3),
                view, HEIGHT).isValid());
        Assertions.assertTrue(validator.validateStateful(payWithNonce(alice, utxo, bob.getAddress(), 600, 100, 7),
                view, HEIGHT).isFutureNonce());
        assertStateful(RejectReason.NONCE_TOO_FAR, payWithNonce(alice, utxo, bob.getAddress(), 600, 100, 8));
    }

    @Test
    public void coinbaseIsNotAllowedOutsideBlockHead() {
        Transaction coinbase = Transaction.createCoinBaseTransaction(HEIGHT, alice.getAddress(), 1000, 0);
        validator.validateStateless(coinbase);
        assertStateful(RejectReason.COINBASE_NOT_ALLOWED, coinbase);
    }

    private void assertStateless(RejectReason expected, Transaction tx) {
        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> validator.validateStateless(tx));
        Assertions.assertEquals(expected, e.getReason());
    }

    private void assertStateful(RejectReason expected, Transaction tx) {
        TxValidationResult result = validator.validateStateful(tx, view, HEIGHT);
        Assertions.assertFalse(result.isValid());
        Assertions.assertEquals(expected, result.getReason(), result.toString());
    }

    private static class TestView implements LedgerView {
        private final Map<String, UTXO> utxos = new HashMap<>();
        private final Map<String, Long> nonces = new HashMap<>();

        UTXO fund(UTXO utxo) {
            utxos.put(utxo.getOutpoint().toKeyHex(), utxo);
            return utxo;
        }

        @Override
        public UTXO getUtxo(Outpoint outpoint) {
            return utxos.get(outpoint.toKeyHex());
        }

        @Override
        public long getNonce(String address) {
            return nonces.getOrDefault(address, 0L);
        }
    }
}
