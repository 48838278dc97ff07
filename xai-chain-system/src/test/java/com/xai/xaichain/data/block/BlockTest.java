package com.xai.xaichain.data.block;

import com.xai.xaichain.ChainFixture;
import com.xai.xaichain.data.transaction.Transaction;
import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ValidationException;
import com.xai.xaichain.util.DifficultyUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.xai.xaichain.constant.BlockChainConstants.BLOCK_HEADER_SIZE;

public class BlockTest {

    private static Block blockWith(int transactionCount) {
        ChainFixture.Wallet wallet = ChainFixture.newWallet();
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < transactionCount - 1; i++) {
            transactions.add(ChainFixture.pay(wallet, ChainFixture.fundingUtxo(wallet.getAddress(), 100_000),
                    wallet.getAddress(), 10_000 + i, 1_000));
        }
        Block parent = new Block();
        parent.setHash(new byte[32]);
        parent.setTime(ChainFixture.GENESIS_TIME);
        parent.setDifficultyTarget(DifficultyUtils.hexToCompact(ChainFixture.EASY_BITS));
        return ChainFixture.buildBlock(parent, wallet.getAddress(), transactions);
    }

    @Test
    public void merklePathProvesEveryTransaction() {
        Block block = blockWith(5);

        for (Transaction tx : block.getTransactions()) {
            MerklePath path = block.generateMerklePath(tx.getTxId());
            byte[] root = Block.calculateRootFromPath(tx.getTxId(), path.getPathHashes(), path.getIndex());
            Assertions.assertArrayEquals(block.getMerkleRoot(), root);

            MerkleProof proof = new MerkleProof(tx.getTxId(), block.getHash(), 1, block.getMerkleRoot(), path);
            Assertions.assertTrue(proof.verify(block.extractHeader()));
        }
        Assertions.assertNull(block.generateMerklePath(new byte[32]));
    }

    @Test
    public void tamperedProofFails() {
        Block block = blockWith(4);
        Transaction tx = block.getTransactions().get(2);
        MerklePath path = block.generateMerklePath(tx.getTxId());

        MerkleProof wrongIndex = new MerkleProof(tx.getTxId(), block.getHash(), 1, block.getMerkleRoot(),
                new MerklePath(path.getPathHashes(), 3));
        MerkleProof wrongBlock = new MerkleProof(tx.getTxId(), new byte[32], 1, block.getMerkleRoot(), path);

        Assertions.assertFalse(wrongIndex.verify(block.extractHeader()));
        Assertions.assertFalse(wrongBlock.verify(block.extractHeader()));
    }

    @Test
    public void singleTransactionRootIsItsId() {
        Block block = blockWith(1);

        Assertions.assertArrayEquals(block.getTransactions().get(0).getTxId(), block.getMerkleRoot());
    }

    @Test
    public void serializedBlockDecodesToSameContent() {
        Block block = blockWith(3);

        Block decoded = Block.deserialize(block.serialize(), 10);

        Assertions.assertArrayEquals(block.getHash(), decoded.getHash());
        Assertions.assertEquals(block.getTransactions(), decoded.getTransactions());
        Assertions.assertEquals(BLOCK_HEADER_SIZE, block.extractHeader().serialize().length);
    }

    @Test
    public void malformedEncodingIsRejected() {
        Block block = blockWith(3);
        byte[] bytes = block.serialize();

        ValidationException tooMany = Assertions.assertThrows(ValidationException.class, () -> Block.deserialize(bytes, 2));
        ValidationException truncated = Assertions.assertThrows(ValidationException.class,
                () -> Block.deserialize(Arrays.copyOf(bytes, bytes.length - 5), 10));
        ValidationException trailing = Assertions.assertThrows(ValidationException.class,
                () -> Block.deserialize(Arrays.copyOf(bytes, bytes.length + 1), 10));

        Assertions.assertEquals(RejectReason.MALFORMED, tooMany.getReason());
        Assertions.assertEquals(RejectReason.MALFORMED, truncated.getReason());
        Assertions.assertEquals(RejectReason.MALFORMED, trailing.getReason());
    }
}
