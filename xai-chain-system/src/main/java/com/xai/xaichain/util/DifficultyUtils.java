package com.xai.xaichain.util;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * 难度目标换算：紧凑格式（nBits）与256位目标值互转、工作量计算
 * 全部使用整数运算，保证各节点结果一致
 */
@Slf4j
public class DifficultyUtils {

    // 2^256
    private static final BigInteger TWO_POW_256 = BigInteger.ONE.shiftLeft(256);

    /**
     * 将4字节压缩格式解析为目标值
     * @param compact 4字节压缩格式数组（大端）
     * @return 目标值（256位BigInteger），符号位置位或为零时抛出异常
     */
    public static BigInteger compactToTarget(byte[] compact) {
        if (compact == null || compact.length != 4) {
            throw new IllegalArgumentException("压缩格式必须为4字节");
        }
        long bits = ByteUtils.bytesToInt(compact) & 0xFFFFFFFFL;
        int size = (int) (bits >>> 24);
        long word = bits & 0x007FFFFFL;
        if ((bits & 0x00800000L) != 0 && word != 0) {
            throw new IllegalArgumentException("难度目标不能为负数");
        }
        BigInteger target;
        if (size <= 3) {
            target = BigInteger.valueOf(word >>> (8 * (3 - size)));
        } else {
            target = BigInteger.valueOf(word).shiftLeft(8 * (size - 3));
        }
        if (target.signum() == 0) {
            throw new IllegalArgumentException("难度目标不能为零");
        }
        if (target.bitLength() > 256) {
            throw new IllegalArgumentException("难度目标超过256位");
        }
        return target;
    }

    /**
     * 将目标值转换为4字节压缩格式（难度目标字段）
     */
    public static byte[] targetToCompact(BigInteger target) {
        if (target.signum() <= 0) {
            throw new IllegalArgumentException("目标值必须为正数");
        }
        int size = (target.bitLength() + 7) / 8;
        long compact;
        if (size <= 3) {
            compact = target.longValue() << (8 * (3 - size));
        } else {
            compact = target.shiftRight(8 * (size - 3)).longValue();
        }
        // 系数最高位为1会被解释为负数，右移一个字节并增大指数
        if ((compact & 0x00800000L) != 0) {
            compact >>>= 8;
            size++;
        }
        compact |= (long) size << 24;
        return ByteUtils.intToBytes((int) compact);
    }

    public static byte[] hexToCompact(String hex) {
        byte[] compact = CryptoUtil.hexToBytes(hex);
        compactToTarget(compact);
        return compact;
    }

    /**
     * 单个区块的工作量 = 2^256 / (target + 1)
     */
    public static BigInteger blockWork(byte[] compact) {
        BigInteger target = compactToTarget(compact);
        return TWO_POW_256.divide(target.add(BigInteger.ONE));
    }

    /**
     * 验证哈希值是否符合难度目标（哈希按大端无符号整数解释）
     */
    public static boolean isValidHash(byte[] hash, byte[] difficultyTarget) {
        if (hash == null || hash.length != 32) {
            throw new IllegalArgumentException("哈希值必须为32字节");
        }
        BigInteger target = compactToTarget(difficultyTarget);
        return new BigInteger(1, hash).compareTo(target) <= 0;
    }

    /**
     * 按实际耗时重新计算目标值，调整系数限制在 [1/4, 4]
     * @param oldTarget 上一周期的目标值
     * @param actualTimespan 窗口实际耗时（秒），非正数按1处理
     * @param expectedTimespan 窗口期望耗时（秒）
     * @param powLimit 允许的最大目标值（最低难度）
     */
    public static BigInteger retarget(BigInteger oldTarget, long actualTimespan, long expectedTimespan, BigInteger powLimit) {
        if (expectedTimespan <= 0) {
            throw new IllegalArgumentException("期望周期时间必须为正数");
        }
        long actual = actualTimespan <= 0 ? 1 : actualTimespan;
        long min = Math.max(1, expectedTimespan / 4);
        long max = Math.multiplyExact(expectedTimespan, 4L);
        actual = Math.max(min, Math.min(max, actual));

        BigInteger newTarget = oldTarget.multiply(BigInteger.valueOf(actual)).divide(BigInteger.valueOf(expectedTimespan));
        if (newTarget.signum() <= 0) {
            newTarget = BigInteger.ONE;
        }
        if (newTarget.compareTo(powLimit) > 0) {
            newTarget = powLimit;
        }
        log.debug("难度调整: 实际耗时={}, 期望耗时={}, 旧目标={}, 新目标={}",
                actual, expectedTimespan, oldTarget.toString(16), newTarget.toString(16));
        return newTarget;
    }
}
