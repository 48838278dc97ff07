package com.xai.xaichain.ledger;

import com.xai.xaichain.data.transaction.Outpoint;
import com.xai.xaichain.data.transaction.UTXO;

/**
 * 账本的只读视图，交易校验只依赖它
 */
public interface LedgerView {

    /**
     * 未花费输出，不存在或已花费返回 null
     */
    UTXO getUtxo(Outpoint outpoint);

    /**
     * 发送者下一个期望的 nonce
     */
    long getNonce(String address);
}
