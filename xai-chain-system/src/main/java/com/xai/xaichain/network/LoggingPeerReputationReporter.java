package com.xai.xaichain.network;

import com.xai.xaichain.exception.RejectReason;
import lombok.extern.slf4j.Slf4j;

/**
 * 未接入网络层时的默认实现，只记录日志
 */
@Slf4j
public class LoggingPeerReputationReporter implements PeerReputationReporter {

    @Override
    public void reportInvalidBlock(String peerId, String blockHash, RejectReason reason) {
        log.warn("节点 {} 发送了无效区块 {}，原因: {}", peerId, blockHash, reason);
    }

    @Override
    public void reportInvalidTransaction(String peerId, String txId, RejectReason reason) {
        log.warn("节点 {} 发送了无效交易 {}，原因: {}", peerId, txId, reason);
    }

    @Override
    public void reportRepeatedOrphans(String peerId, int expiredCount) {
        log.warn("节点 {} 的孤块已过期 {} 次", peerId, expiredCount);
    }
}
