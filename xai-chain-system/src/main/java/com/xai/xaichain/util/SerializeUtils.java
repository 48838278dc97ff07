package com.xai.xaichain.util;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import com.xai.xaichain.data.block.BlockIndexEntry;
import com.xai.xaichain.data.block.BlockStatus;
import com.xai.xaichain.data.checkpoint.Checkpoint;
import com.xai.xaichain.data.ledger.BlockUndo;
import com.xai.xaichain.data.transaction.UTXO;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * 存储记录序列化工具（Kryo 5.x，每线程一个实例）
 * 注册顺序决定类ID，只能在末尾追加
 */
public class SerializeUtils {

    private static final ThreadLocal<Kryo> kryoThreadLocal = ThreadLocal.withInitial(() -> {
        Kryo kryo = new Kryo();
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy());
        kryo.setRegistrationRequired(true);
        kryo.setReferences(false);

        // 基础类型
        kryo.register(byte[].class);
        kryo.register(BigInteger.class);
        kryo.register(ArrayList.class);
        kryo.register(LinkedHashMap.class);

        // 存储记录
        kryo.register(UTXO.class);
        kryo.register(BlockStatus.class);
        kryo.register(BlockIndexEntry.class);
        kryo.register(BlockUndo.class);
        kryo.register(Checkpoint.class);
        return kryo;
    });

    /**
     * 反序列化（从字节数组恢复对象）
     */
    public static <T> T deSerialize(byte[] bytes, Class<T> type) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        Kryo kryo = kryoThreadLocal.get();
        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (RuntimeException e) {
            throw new IllegalStateException("反序列化失败: " + type.getSimpleName(), e);
        }
    }

    /**
     * 序列化（将对象转为字节数组）
     */
    public static byte[] serialize(Object object) {
        if (object == null) {
            return new byte[0];
        }
        Kryo kryo = kryoThreadLocal.get();
        try (Output output = new Output(256, -1)) {
            kryo.writeObject(output, object);
            return output.toBytes();
        } catch (RuntimeException e) {
            throw new IllegalStateException("序列化失败: " + object.getClass().getSimpleName(), e);
        }
    }
}
