package com.xai.xaichain.storage;

import com.xai.xaichain.data.block.Block;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.checkpoint.Checkpoint;
import com.xai.xaichain.data.ledger.BlockUndo;
import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.UTXO;
import com.xai.xaichain.exception.StorageFailureException;
import com.xai.xaichain.util.ByteUtils;
import com.xai.xaichain.util.SerializeUtils;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * RocksDB 实现：每类记录一个列族，批次基于 WriteBatch 原子提交
 */
@Slf4j
public class RocksDbChainStore implements ChainStore {

    private static final byte[] KEY_TIP_HASH = "key_main_tip_hash".getBytes(StandardCharsets.UTF_8);
    private static final byte[] KEY_TOTAL_SUPPLY = "key_total_supply".getBytes(StandardCharsets.UTF_8);
    private static final byte[] KEY_UTXO_COUNT = "key_utxo_count".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final String dbPath;
    private final RocksDB db;
    private final DBOptions dbOptions;
    private final Map<ColumnFamily, ColumnFamilyHandle> handles = new EnumMap<>(ColumnFamily.class);
    private final List<ColumnFamilyHandle> allHandles = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RocksDbChainStore(String dbPath) {
        this.dbPath = dbPath.endsWith("/") ? dbPath : dbPath + "/";
        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL)
                .setMaxLogFileSize(1024 * 1024)
                .setKeepLogFileNum(2);
        try {
            this.db = openRocksDBWithColumnFamilies();
            log.info("数据库已打开: {}", this.dbPath);
        } catch (RocksDBException e) {
            log.error("初始化数据库失败: {}", this.dbPath, e);
            throw new StorageFailureException("数据库初始化失败", e);
        }
    }

    private RocksDB openRocksDBWithColumnFamilies() throws RocksDBException {
        File dbDir = new File(dbPath);
        if (!dbDir.exists() && !dbDir.mkdirs()) {
            throw new StorageFailureException("创建数据库目录失败: " + dbPath);
        }
        String logDir = dbPath + "rocksdb_logs/";
        if (!new File(logDir).exists() && !new File(logDir).mkdirs()) {
            throw new StorageFailureException("创建数据库日志目录失败: " + logDir);
        }
        dbOptions.setDbLogDir(logDir);

        List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
        // 默认列族必须包含
        cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));
        for (ColumnFamily cf : ColumnFamily.values()) {
            cfDescriptors.add(new ColumnFamilyDescriptor(cf.actualName.getBytes(StandardCharsets.UTF_8), cf.newOptions()));
        }

        RocksDB rocksDB = RocksDB.open(dbOptions, dbPath, cfDescriptors, allHandles);
        // 跳过默认列族（索引0）
        for (int i = 0; i < ColumnFamily.values().length; i++) {
            handles.put(ColumnFamily.values()[i], allHandles.get(i + 1));
        }
        return rocksDB;
    }

    // ------------------------------ 区块 ------------------------------

    @Override
    public Block getBlock(byte[] hash) {
        byte[] data = get(ColumnFamily.BLOCK, hash, "获取区块失败");
        if (data == null) {
            return null;
        }
        Block block = Block.deserialize(data, Integer.MAX_VALUE);
        BlockIndexEntry entry = getIndexEntry(hash);
        if (entry != null) {
            block.setHeight(entry.getHeight());
        }
        return block;
    }

    @Override
    public BlockIndexEntry getIndexEntry(byte[] hash) {
        return SerializeUtils.deSerialize(get(ColumnFamily.BLOCK_INDEX, hash, "获取区块索引失败"), BlockIndexEntry.class);
    }

    @Override
    public byte[] getMainBlockHash(long height) {
        return get(ColumnFamily.MAIN_CHAIN_INDEX, ByteUtils.toBytes(height), "通过高度获取区块hash失败");
    }

    @Override
    public byte[] getTransactionBlockHash(byte[] txId) {
        return get(ColumnFamily.TRANSACTION_INDEX, txId, "获取交易所在区块失败");
    }

    @Override
    public BlockUndo getUndo(byte[] blockHash) {
        return SerializeUtils.deSerialize(get(ColumnFamily.BLOCK_UNDO, blockHash, "获取区块回滚数据失败"), BlockUndo.class);
    }

    @Override
    public byte[] getTipHash() {
        return get(ColumnFamily.CHAIN_META, KEY_TIP_HASH, "获取主链链尖失败");
    }

    @Override
    public void forEachIndexEntry(Consumer<BlockIndexEntry> consumer) {
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.BLOCK_INDEX))) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                consumer.accept(SerializeUtils.deSerialize(iterator.value(), BlockIndexEntry.class));
            }
        }
    }

    // ------------------------------ UTXO ------------------------------

    @Override
    public UTXO getUtxo(Outpoint outpoint) {
        return SerializeUtils.deSerialize(get(ColumnFamily.UTXO, outpoint.toKey(), "获取UTXO失败"), UTXO.class);
    }

    @Override
    public List<UTXO> getUtxosByAddress(String address) {
        List<UTXO> result = new ArrayList<>();
        byte[] prefix = addressPrefix(address);
        try (ReadOptions readOptions = new ReadOptions().setPrefixSameAsStart(true);
             RocksIterator iterator = db.newIterator(handle(ColumnFamily.ADDRESS_UTXO), readOptions)) {
            for (iterator.seek(prefix); iterator.isValid(); iterator.next()) {
                byte[] key = iterator.key();
                if (!ByteUtils.startsWith(key, prefix)) {
                    break;
                }
                byte[] outpointKey = new byte[key.length - prefix.length];
                System.arraycopy(key, prefix.length, outpointKey, 0, outpointKey.length);
                UTXO utxo = SerializeUtils.deSerialize(get(ColumnFamily.UTXO, outpointKey, "获取UTXO失败"), UTXO.class);
                if (utxo == null) {
                    log.warn("地址索引指向不存在的UTXO: {}", Outpoint.fromKey(outpointKey));
                    continue;
                }
                result.add(utxo);
            }
        }
        return result;
    }

    @Override
    public long getNonce(String address) {
        byte[] data = get(ColumnFamily.ACCOUNT_NONCE, address.getBytes(StandardCharsets.UTF_8), "获取账户nonce失败");
        return data == null ? 0 : ByteUtils.bytesToLong(data);
    }

    @Override
    public long getTotalSupply() {
        byte[] data = get(ColumnFamily.CHAIN_META, KEY_TOTAL_SUPPLY, "获取发行总量失败");
        return data == null ? 0 : ByteUtils.bytesToLong(data);
    }

    @Override
    public long getUtxoCount() {
        byte[] data = get(ColumnFamily.CHAIN_META, KEY_UTXO_COUNT, "获取UTXO总数失败");
        return data == null ? 0 : ByteUtils.bytesToLong(data);
    }

    @Override
    public void forEachUtxo(Consumer<UTXO> consumer) {
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.UTXO))) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                consumer.accept(SerializeUtils.deSerialize(iterator.value(), UTXO.class));
            }
        }
    }

    // ------------------------------ 检查点 ------------------------------

    @Override
    public Checkpoint getCheckpoint(long height) {
        return SerializeUtils.deSerialize(get(ColumnFamily.CHECKPOINT, ByteUtils.toBytes(height), "获取检查点失败"), Checkpoint.class);
    }

    @Override
    public List<Checkpoint> listCheckpoints() {
        List<Checkpoint> result = new ArrayList<>();
        // 高度为大端编码，键序即高度升序
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.CHECKPOINT))) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                result.add(SerializeUtils.deSerialize(iterator.value(), Checkpoint.class));
            }
        }
        return result;
    }

    @Override
    public StoreBatch newBatch() {
        return new RocksBatch();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("关闭数据库资源: {}", dbPath);
        for (ColumnFamilyHandle cfHandle : allHandles) {
            cfHandle.close();
        }
        db.close();
        dbOptions.close();
    }

    // ------------------------------ 内部 ------------------------------

    private byte[] get(ColumnFamily cf, byte[] key, String errorMessage) {
        try {
            return db.get(handle(cf), key);
        } catch (RocksDBException e) {
            log.error("{}: cf={}", errorMessage, cf.logicalName, e);
            throw new StorageFailureException(errorMessage, e);
        }
    }

    private ColumnFamilyHandle handle(ColumnFamily cf) {
        if (closed.get()) {
            throw new StorageFailureException("数据库已关闭");
        }
        return handles.get(cf);
    }

    private static byte[] addressPrefix(String address) {
        return (address + "_").getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] addressIndexKey(UTXO utxo) {
        return ByteUtils.concat(addressPrefix(utxo.getAddress()), utxo.getOutpoint().toKey());
    }

    private class RocksBatch implements StoreBatch {

        private final WriteBatch writeBatch = new WriteBatch();

        private void put(ColumnFamily cf, byte[] key, byte[] value) {
            try {
                writeBatch.put(handle(cf), key, value);
            } catch (RocksDBException e) {
                throw new StorageFailureException("写入批次失败: " + cf.logicalName, e);
            }
        }

        private void delete(ColumnFamily cf, byte[] key) {
            try {
                writeBatch.delete(handle(cf), key);
            } catch (RocksDBException e) {
                throw new StorageFailureException("写入批次失败: " + cf.logicalName, e);
            }
        }

        @Override
        public StoreBatch putBlock(Block block) {
            put(ColumnFamily.BLOCK, block.getHash(), block.serialize());
            return this;
        }

        @Override
        public StoreBatch putIndexEntry(BlockIndexEntry entry) {
            put(ColumnFamily.BLOCK_INDEX, entry.getHash(), SerializeUtils.serialize(entry));
            return this;
        }

        @Override
        public StoreBatch putMainBlockHash(long height, byte[] hash) {
            put(ColumnFamily.MAIN_CHAIN_INDEX, ByteUtils.toBytes(height), hash);
            return this;
        }

        @Override
        public StoreBatch deleteMainBlockHash(long height) {
            delete(ColumnFamily.MAIN_CHAIN_INDEX, ByteUtils.toBytes(height));
            return this;
        }

        @Override
        public StoreBatch putTransactionIndex(byte[] txId, byte[] blockHash) {
            put(ColumnFamily.TRANSACTION_INDEX, txId, blockHash);
            return this;
        }

        @Override
        public StoreBatch deleteTransactionIndex(byte[] txId) {
            delete(ColumnFamily.TRANSACTION_INDEX, txId);
            return this;
        }

        @Override
        public StoreBatch putUndo(BlockUndo undo) {
            put(ColumnFamily.BLOCK_UNDO, undo.getBlockHash(), SerializeUtils.serialize(undo));
            return this;
        }

        @Override
        public StoreBatch deleteUndo(byte[] blockHash) {
            delete(ColumnFamily.BLOCK_UNDO, blockHash);
            return this;
        }

        @Override
        public StoreBatch putTipHash(byte[] hash) {
            put(ColumnFamily.CHAIN_META, KEY_TIP_HASH, hash);
            return this;
        }

        @Override
        public StoreBatch putUtxo(UTXO utxo) {
            put(ColumnFamily.UTXO, utxo.getOutpoint().toKey(), SerializeUtils.serialize(utxo));
            put(ColumnFamily.ADDRESS_UTXO, addressIndexKey(utxo), ByteUtils.toBytes(utxo.getValue()));
            return this;
        }

        @Override
        public StoreBatch deleteUtxo(UTXO utxo) {
            delete(ColumnFamily.UTXO, utxo.getOutpoint().toKey());
            delete(ColumnFamily.ADDRESS_UTXO, addressIndexKey(utxo));
            return this;
        }

        @Override
        public StoreBatch putNonce(String address, long nextNonce) {
            byte[] key = address.getBytes(StandardCharsets.UTF_8);
            if (nextNonce == 0) {
                delete(ColumnFamily.ACCOUNT_NONCE, key);
            } else {
                put(ColumnFamily.ACCOUNT_NONCE, key, ByteUtils.toBytes(nextNonce));
            }
            return this;
        }

        @Override
        public StoreBatch putTotalSupply(long totalSupply) {
            put(ColumnFamily.CHAIN_META, KEY_TOTAL_SUPPLY, ByteUtils.toBytes(totalSupply));
            return this;
        }

        @Override
        public StoreBatch putUtxoCount(long utxoCount) {
            put(ColumnFamily.CHAIN_META, KEY_UTXO_COUNT, ByteUtils.toBytes(utxoCount));
            return this;
        }

        @Override
        public StoreBatch putCheckpoint(Checkpoint checkpoint) {
            put(ColumnFamily.CHECKPOINT, checkpoint.storageKey(), SerializeUtils.serialize(checkpoint));
            return this;
        }

        @Override
        public StoreBatch deleteCheckpoint(long height) {
            delete(ColumnFamily.CHECKPOINT, ByteUtils.toBytes(height));
            return this;
        }

        @Override
        public void commit() {
            try (WriteOptions writeOptions = new WriteOptions().setSync(true)) {
                db.write(writeOptions, writeBatch);
            } catch (RocksDBException e) {
                log.error("批量写入失败，共{}条操作", writeBatch.count(), e);
                throw new StorageFailureException("批量写入失败", e);
            } finally {
                writeBatch.close();
            }
        }
    }

    enum ColumnFamily {
        //链元数据：链尖、发行总量、UTXO总数
        CHAIN_META("CF_CHAIN_META", "chainMeta"),
        //hash -> 区块规范编码
        BLOCK("CF_BLOCK", "block"),
        //hash -> 区块索引
        BLOCK_INDEX("CF_BLOCK_INDEX", "blockIndex"),
        //主链索引 高度到区块哈希
        MAIN_CHAIN_INDEX("CF_MAIN_CHAIN_INDEX", "mainChainIndex"),
        //交易到区块的索引，仅主链
        TRANSACTION_INDEX("CF_TRANSACTION_INDEX", "transactionIndex"),
        //hash -> 回滚数据
        BLOCK_UNDO("CF_BLOCK_UNDO", "blockUndo"),
        //UTXO 基础索引
        UTXO("CF_UTXO", "utxo"),
        //地址_utxoKey -> 金额
        ADDRESS_UTXO("CF_ADDRESS_UTXO", "addressUtxo"),
        //地址 -> 下一个期望 nonce
        ACCOUNT_NONCE("CF_ACCOUNT_NONCE", "accountNonce"),
        //高度 -> 检查点
        CHECKPOINT("CF_CHECKPOINT", "checkpoint"),
        ;
        final String logicalName;
        final String actualName;

        ColumnFamily(String logicalName, String actualName) {
            this.logicalName = logicalName;
            this.actualName = actualName;
        }

        ColumnFamilyOptions newOptions() {
            ColumnFamilyOptions options = new ColumnFamilyOptions();
            if (this == UTXO) {
                options.setTableFormatConfig(new BlockBasedTableConfig()
                        .setBlockCache(new LRUCache(64 * 1024 * 1024))
                        .setCacheIndexAndFilterBlocks(true));
            }
            return options;
        }
    }

    @Override
    public String toString() {
        return "RocksDbChainStore{" + dbPath + "}";
    }
}
