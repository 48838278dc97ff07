package com.xai.xaichain.constant;

/**
 * 协议常量：所有节点必须一致，不允许通过配置修改
 * 策略性阈值（重组深度、时间偏移、交易池容量等）见 SystemConfig
 */
public class BlockChainConstants {

    // 交易版本 1基础交易版本
    public static final int TRANSACTION_VERSION_1 = 1;

    // 区块版本
    public static final int BLOCK_VERSION_1 = 1;

    //单位 1e8
    public static final long COIN = 100_000_000L;

    //货币总供应量 1.21亿
    public static final long MAX_SUPPLY = 121_000_000L * COIN;

    //创世区块前序hash
    public static final byte[] GENESIS_PREV_BLOCK_HASH = new byte[32];

    //时间窗口大小 中位时间取前11个区块
    public static final int TIME_WINDOW_SIZE = 11;

    //区块头固定80字节
    public static final int BLOCK_HEADER_SIZE = 80;

    //单次获取区块头的最大数量
    public static final int MAX_HEADERS_PER_REQUEST = 2000;

    //解码时单个交易输入/输出数量上限
    public static final int MAX_TX_IO_COUNT = 10_000;

    //公钥、签名、地址字段的最大字节数
    public static final int MAX_PUBLIC_KEY_SIZE = 128;
    public static final int MAX_SIGNATURE_SIZE = 80;
    public static final int MAX_ADDRESS_SIZE = 64;

    //区块时间戳字段为32位无符号秒
    public static final long MAX_BLOCK_TIME = 0xFFFFFFFFL;
}
