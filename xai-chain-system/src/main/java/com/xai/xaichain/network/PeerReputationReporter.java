package com.xai.xaichain.network;

import com.xai.xaichain.exception.RejectReason;

/**
 * 网络层的信誉评分接口；共识核心只上报信号，不做网络层封禁
 */
public interface PeerReputationReporter {

    void reportInvalidBlock(String peerId, String blockHash, RejectReason reason);

    void reportInvalidTransaction(String peerId, String txId, RejectReason reason);

    /**
     * 同一节点发来的孤块反复过期
     */
    void reportRepeatedOrphans(String peerId, int expiredCount);
}
