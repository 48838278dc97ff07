package com.xai.xaichain.util;

import org.apache.commons.lang3.ArrayUtils;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 字节数组工具类
 */
public class ByteUtils {

    /**
     * 将多个字节数组合并成一个字节数组
     */
    public static byte[] merge(byte[]... bytes) {
        byte[] result = ArrayUtils.EMPTY_BYTE_ARRAY;
        for (byte[] b : bytes) {
            result = ArrayUtils.addAll(result, b);
        }
        return result;
    }

    /**
     * 两个byte[]数组相加
     */
    public static byte[] concat(byte[] data1, byte[] data2) {
        byte[] result = new byte[data1.length + data2.length];
        System.arraycopy(data1, 0, result, 0, data1.length);
        System.arraycopy(data2, 0, result, data1.length, data2.length);
        return result;
    }

    /**
     * long 类型转 byte[]（大端，用作有序键）
     */
    public static byte[] toBytes(long val) {
        return ByteBuffer.allocate(Long.BYTES).putLong(val).array();
    }

    /**
     * byte[] to LONG
     */
    public static long bytesToLong(byte[] bytes) {
        return ByteBuffer.wrap(bytes).getLong();
    }

    /**
     * int 类型转 byte[]（大端）
     */
    public static byte[] intToBytes(int val) {
        return ByteBuffer.allocate(Integer.BYTES).putInt(val).array();
    }

    public static int bytesToInt(byte[] bytes) {
        return ByteBuffer.wrap(bytes).getInt();
    }

    /**
     * 反转字节序（大小端互换），返回新数组
     */
    public static byte[] reverseBytes(byte[] bytes) {
        byte[] copy = Arrays.copyOf(bytes, bytes.length);
        ArrayUtils.reverse(copy);
        return copy;
    }

    /**
     * 按无符号字节逐位比较
     */
    public static int compareUnsigned(byte[] a, byte[] b) {
        return Arrays.compareUnsigned(a, b);
    }

    /**
     * 判断 data 是否以 prefix 开头
     */
    public static boolean startsWith(byte[] data, byte[] prefix) {
        if (data == null || prefix == null || data.length < prefix.length) {
            return false;
        }
        return Arrays.equals(data, 0, prefix.length, prefix, 0, prefix.length);
    }
}
