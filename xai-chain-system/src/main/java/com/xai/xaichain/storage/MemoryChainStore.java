package com.xai.xaichain.storage;

import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.checkpoint.Checkpoint;
import com.xai.xaichain.data.ledger.BlockUndo;
import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.util.CryptoUtil;
import com.xai.xaichain.util.SerializeUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * 内存实现：值的编码与 RocksDB 实现一致（区块用规范编码，其余记录用 Kryo），读出的总是副本
 */
@Slf4j
public class MemoryChainStore implements ChainStore {

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    private final Map<String, byte[]> blocks = new HashMap<>();
    private final Map<String, byte[]> indexEntries = new HashMap<>();
    private final TreeMap<Long, byte[]> mainChain = new TreeMap<>();
    private final Map<String, byte[]> transactionIndex = new HashMap<>();
    private final Map<String, byte[]> undo = new HashMap<>();
    private final TreeMap<String, byte[]> utxos = new TreeMap<>();
    private final Map<String, NavigableSet<String>> addressIndex = new HashMap<>();
    private final Map<String, Long> nonces = new HashMap<>();
    private final TreeMap<Long, byte[]> checkpoints = new TreeMap<>();
    private byte[] tipHash;
    private long totalSupply;
    private long utxoCount;

    @Override
    public Block getBlock(byte[] hash) {
        rwLock.readLock().lock();
        try {
            byte[] data = blocks.get(CryptoUtil.bytesToHex(hash));
            if (data == null) {
                return null;
            }
            Block block = Block.deserialize(data, Integer.MAX_VALUE);
            BlockIndexEntry entry = SerializeUtils.deSerialize(indexEntries.get(CryptoUtil.bytesToHex(hash)), BlockIndexEntry.class);
            if (entry != null) {
                block.setHeight(entry.getHeight());
            }
            return block;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public BlockIndexEntry getIndexEntry(byte[] hash) {
        return read(() -> SerializeUtils.deSerialize(indexEntries.get(CryptoUtil.bytesToHex(hash)), BlockIndexEntry.class));
    }

    @Override
    public byte[] getMainBlockHash(long height) {
        return read(() -> copy(mainChain.get(height)));
    }

    @Override
    public byte[] getTransactionBlockHash(byte[] txId) {
        return read(() -> copy(transactionIndex.get(CryptoUtil.bytesToHex(txId))));
    }

    @Override
    public BlockUndo getUndo(byte[] blockHash) {
        return read(() -> SerializeUtils.deSerialize(undo.get(CryptoUtil.bytesToHex(blockHash)), BlockUndo.class));
    }

    @Override
    public byte[] getTipHash() {
        return read(() -> copy(tipHash));
    }

    @Override
    public void forEachIndexEntry(Consumer<BlockIndexEntry> consumer) {
        List<byte[]> snapshot = read(() -> new ArrayList<>(indexEntries.values()));
        for (byte[] data : snapshot) {
            consumer.accept(SerializeUtils.deSerialize(data, BlockIndexEntry.class));
        }
    }

    @Override
    public UTXO getUtxo(Outpoint outpoint) {
        return read(() -> SerializeUtils.deSerialize(utxos.get(outpoint.toKeyHex()), UTXO.class));
    }

    @Override
    public List<UTXO> getUtxosByAddress(String address) {
        return read(() -> {
            List<UTXO> result = new ArrayList<>();
            NavigableSet<String> keys = addressIndex.get(address);
            if (keys != null) {
                for (String key : keys) {
                    result.add(SerializeUtils.deSerialize(utxos.get(key), UTXO.class));
                }
            }
            return result;
        });
    }

    @Override
    public long getNonce(String address) {
        return read(() -> nonces.getOrDefault(address, 0L));
    }

    @Override
    public long getTotalSupply() {
        return read(() -> totalSupply);
    }

    @Override
    public long getUtxoCount() {
        return read(() -> utxoCount);
    }

    @Override
    public void forEachUtxo(Consumer<UTXO> consumer) {
        List<byte[]> snapshot = read(() -> new ArrayList<>(utxos.values()));
        for (byte[] data : snapshot) {
            consumer.accept(SerializeUtils.deSerialize(data, UTXO.class));
        }
    }

    @Override
    public Checkpoint getCheckpoint(long height) {
        return read(() -> SerializeUtils.deSerialize(checkpoints.get(height), Checkpoint.class));
    }

    @Override
    public List<Checkpoint> listCheckpoints() {
        return read(() -> {
            List<Checkpoint> result = new ArrayList<>();
            for (byte[] data : checkpoints.values()) {
                result.add(SerializeUtils.deSerialize(data, Checkpoint.class));
            }
            return result;
        });
    }

    @Override
    public StoreBatch newBatch() {
        return new MemoryBatch();
    }

    @Override
    public void close() {
        log.debug("关闭内存存储");
    }

    private <T> T read(java.util.function.Supplier<T> reader) {
        rwLock.readLock().lock();
        try {
            return reader.get();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    private static byte[] copy(byte[] data) {
        return data == null ? null : data.clone();
    }

    /**
     * 操作先缓存，commit 时在写锁内一次性执行
     */
    private class MemoryBatch implements StoreBatch {

        private final List<Runnable> operations = new ArrayList<>();

        @Override
        public StoreBatch putBlock(Block block) {
            String key = block.getHashHex();
            byte[] data = block.serialize();
            operations.add(() -> blocks.put(key, data));
            return this;
        }

        @Override
        public StoreBatch putIndexEntry(BlockIndexEntry entry) {
            String key = entry.getHashHex();
            byte[] data = SerializeUtils.serialize(entry);
            operations.add(() -> indexEntries.put(key, data));
            return this;
        }

        @Override
        public StoreBatch putMainBlockHash(long height, byte[] hash) {
            byte[] data = hash.clone();
            operations.add(() -> mainChain.put(height, data));
            return this;
        }

        @Override
        public StoreBatch deleteMainBlockHash(long height) {
            operations.add(() -> mainChain.remove(height));
            return this;
        }

        @Override
        public StoreBatch putTransactionIndex(byte[] txId, byte[] blockHash) {
            String key = CryptoUtil.bytesToHex(txId);
            byte[] data = blockHash.clone();
            operations.add(() -> transactionIndex.put(key, data));
            return this;
        }

        @Override
        public StoreBatch deleteTransactionIndex(byte[] txId) {
            String key = CryptoUtil.bytesToHex(txId);
            operations.add(() -> transactionIndex.remove(key));
            return this;
        }

        @Override
        public StoreBatch putUndo(BlockUndo blockUndo) {
            String key = CryptoUtil.bytesToHex(blockUndo.getBlockHash());
            byte[] data = SerializeUtils.serialize(blockUndo);
            operations.add(() -> undo.put(key, data));
            return this;
        }

        @Override
        public StoreBatch deleteUndo(byte[] blockHash) {
            String key = CryptoUtil.bytesToHex(blockHash);
            operations.add(() -> undo.remove(key));
            return this;
        }

        @Override
        public StoreBatch putTipHash(byte[] hash) {
            byte[] data = hash.clone();
            operations.add(() -> tipHash = data);
            return this;
        }

        @Override
        public StoreBatch putUtxo(UTXO utxo) {
            String key = utxo.getOutpoint().toKeyHex();
            String address = utxo.getAddress();
            byte[] data = SerializeUtils.serialize(utxo);
            operations.add(() -> {
                utxos.put(key, data);
                addressIndex.computeIfAbsent(address, a -> new TreeSet<>()).add(key);
            });
            return this;
        }

        @Override
        public StoreBatch deleteUtxo(UTXO utxo) {
            String key = utxo.getOutpoint().toKeyHex();
            String address = utxo.getAddress();
            operations.add(() -> {
                utxos.remove(key);
                NavigableSet<String> keys = addressIndex.get(address);
                if (keys != null) {
                    keys.remove(key);
                    if (keys.isEmpty()) {
                        addressIndex.remove(address);
                    }
                }
            });
            return this;
        }

        @Override
        public StoreBatch putNonce(String address, long nextNonce) {
            operations.add(() -> {
                if (nextNonce == 0) {
                    nonces.remove(address);
                } else {
                    nonces.put(address, nextNonce);
                }
            });
            return this;
        }

        @Override
        public StoreBatch putTotalSupply(long value) {
            operations.add(() -> totalSupply = value);
            return this;
        }

        @Override
        public StoreBatch putUtxoCount(long value) {
            operations.add(() -> utxoCount = value);
            return this;
        }

        @Override
        public StoreBatch putCheckpoint(Checkpoint checkpoint) {
            long height = checkpoint.getHeight();
            byte[] data = SerializeUtils.serialize(checkpoint);
            operations.add(() -> checkpoints.put(height, data));
            return this;
        }

        @Override
        public StoreBatch deleteCheckpoint(long height) {
            operations.add(() -> checkpoints.remove(height));
            return this;
        }

        @Override
        public void commit() {
            rwLock.writeLock().lock();
            try {
                for (Runnable operation : operations) {
                    operation.run();
                }
                operations.clear();
            } finally {
                rwLock.writeLock().unlock();
            }
        }
    }
}
