package com.xai.xaichain.ledger;

import com.xai.xaichain.ChainFixture;
import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.ledger.LedgerDelta;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.exception.MissingOutpointException;
import com.xai.xaichain.storage.MemoryChainStore;
import com.xai.xaichain.util.DifficultyUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.xai.xaichain.ChainFixture.REWARD;
import static com.xai.xaichain.ChainFixture.buildBlock;
import static com.xai.xaichain.ChainFixture.coinbaseUtxo;
import static com.xai.xaichain.ChainFixture.pay;
import static com.xai.xaichain.ChainFixture.payWithNonce;

public class UtxoLedgerTest {

    private static final long AMOUNT = 5L * 100_000_000L;
    private static final long FEE = 1000;

    private MemoryChainStore store;
    private UtxoLedger ledger;
    private ChainFixture.Wallet alice;
    private ChainFixture.Wallet bob;
    private Block root;

    @BeforeEach
    public void setUp() {
        store = new MemoryChainStore();
        ledger = new UtxoLedger(store);
        alice = ChainFixture.newWallet();
        bob = ChainFixture.newWallet();

        root = new Block();
        root.setHeight(0);
        root.setHash(new byte[32]);
        root.setTime(ChainFixture.GENESIS_TIME);
        root.setDifficultyTarget(DifficultyUtils.hexToCompact(ChainFixture.EASY_BITS));
    }

    @Test
    public void applyAndRevertRestoreLedgerExactly() {
        Block first = buildBlock(root, alice.getAddress(), Collections.emptyList());
        LedgerDelta firstDelta = ledger.applyBlock(first, 1, null);
        Assertions.assertEquals(REWARD, firstDelta.getMinted());
        Assertions.assertEquals(REWARD, ledger.getTotalSupply());
        Assertions.assertEquals(1, ledger.getUtxoCount());
        Assertions.assertEquals(REWARD, ledger.getBalance(alice.getAddress()));

        Transaction payment = payWithNonce(alice, coinbaseUtxo(first), bob.getAddress(), AMOUNT, FEE, 0);
        Block second = buildBlock(first, bob.getAddress(), Collections.singletonList(payment));
        LedgerDelta secondDelta = ledger.applyBlock(second, 2, null);

        // CoinBase 只领取基础奖励，未领取的手续费不再发行
        Assertions.assertEquals(FEE, secondDelta.getFees());
        Assertions.assertEquals(REWARD - FEE, secondDelta.getMinted());
        Assertions.assertEquals(2 * REWARD - FEE, ledger.getTotalSupply());
        Assertions.assertEquals(3, ledger.getUtxoCount());
        Assertions.assertEquals(REWARD - AMOUNT - FEE, ledger.getBalance(alice.getAddress()));
        Assertions.assertEquals(REWARD + AMOUNT, ledger.getBalance(bob.getAddress()));
        Assertions.assertEquals(1, ledger.getNonce(alice.getAddress()));
        Assertions.assertEquals(1, secondDelta.getSpent().size());
        Assertions.assertEquals(0L, secondDelta.getPreviousNonces().get(alice.getAddress()));
        Assertions.assertNull(ledger.getUtxo(coinbaseUtxo(first).getOutpoint()));

        LedgerDelta reverted = ledger.revertBlock(second, 2, null);
        Assertions.assertEquals(-(REWARD - FEE), reverted.getMinted());
        Assertions.assertEquals(REWARD, ledger.getTotalSupply());
        Assertions.assertEquals(1, ledger.getUtxoCount());
        Assertions.assertEquals(REWARD, ledger.getBalance(alice.getAddress()));
        Assertions.assertEquals(0, ledger.getBalance(bob.getAddress()));
        Assertions.assertEquals(0, ledger.getNonce(alice.getAddress()));
        Assertions.assertNotNull(ledger.getUtxo(coinbaseUtxo(first).getOutpoint()));
        Assertions.assertNull(store.getUndo(second.getHash()));

        ledger.revertBlock(first, 1, null);
        Assertions.assertEquals(0, ledger.getTotalSupply());
        Assertions.assertEquals(0, ledger.getUtxoCount());
        Assertions.assertTrue(ledger.getUtxos(alice.getAddress()).isEmpty());
        Assertions.assertTrue(ledger.getStateVersion() >= 4);
    }

    @Test
    public void outputsCreatedInBlockCanBeSpentLaterInSameBlock() {
        Block first = buildBlock(root, alice.getAddress(), Collections.emptyList());
        ledger.applyBlock(first, 1, null);

        Transaction parent = pay(alice, coinbaseUtxo(first), bob.getAddress(), AMOUNT, FEE);
        UTXO bobOutput = ChainFixture.outputOf(parent, 0, 2);
        Transaction child = pay(bob, bobOutput, alice.getAddress(), AMOUNT - FEE, FEE);
        Block second = buildBlock(first, bob.getAddress(), Arrays.asList(parent, child));
        LedgerDelta delta = ledger.applyBlock(second, 2, null);

        Assertions.assertEquals(2 * FEE, delta.getFees());
        Assertions.assertEquals(REWARD - FEE - FEE, ledger.getBalance(alice.getAddress()));
        Assertions.assertNull(ledger.getUtxo(bobOutput.getOutpoint()));

        ledger.revertBlock(second, 2, null);
        Assertions.assertEquals(REWARD, ledger.getBalance(alice.getAddress()));
        Assertions.assertEquals(1, ledger.getUtxoCount());
    }

    @Test
    public void missingInputLeavesLedgerUntouched() {
        Block first = buildBlock(root, alice.getAddress(), Collections.emptyList());
        ledger.applyBlock(first, 1, null);
        long version = ledger.getStateVersion();

        Transaction spend = pay(alice, coinbaseUtxo(first), bob.getAddress(), AMOUNT, FEE);
        Transaction doubleSpend = pay(alice, coinbaseUtxo(first), alice.getAddress(), AMOUNT, FEE);
        Block second = buildBlock(first, bob.getAddress(), Arrays.asList(spend, doubleSpend));

        MissingOutpointException e = Assertions.assertThrows(MissingOutpointException.class,
                () -> ledger.applyBlock(second, 2, null));
        Assertions.assertEquals(coinbaseUtxo(first).getOutpoint(), e.getOutpoint());
        Assertions.assertEquals(version, ledger.getStateVersion());
        Assertions.assertEquals(REWARD, ledger.getTotalSupply());
        Assertions.assertEquals(1, ledger.getUtxoCount());
        Assertions.assertNotNull(ledger.getUtxo(coinbaseUtxo(first).getOutpoint()));
    }
}
