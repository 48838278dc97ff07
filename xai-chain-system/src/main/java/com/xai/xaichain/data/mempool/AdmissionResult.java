package com.xai.xaichain.data.mempool;

/**
 * 交易提交成功时的去向
 */
public enum AdmissionResult {
    // 进入交易池，可被打包
    ACCEPTED,
    // 进入交易池，并替换了冲突的交易
    REPLACED,
    // nonce 超前，暂存等待前序 nonce 确认
    FUTURE_NONCE,
    // 引用了未知交易的输出，暂存为孤儿交易
    ORPHAN
}
