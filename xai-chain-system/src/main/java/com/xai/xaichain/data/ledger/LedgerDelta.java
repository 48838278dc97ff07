package com.xai.xaichain.data.ledger;

import com.xai.xaichain.data.transaction.UTXO;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次 apply/revert 对账本的全部影响
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class LedgerDelta {

    private byte[] blockHash;

    private long height;

    // 被消耗的输出
    private List<UTXO> spent = new ArrayList<>();

    // 新创建的输出
    private List<UTXO> created = new ArrayList<>();

    // 发送者 -> 新的下一个期望 nonce
    private Map<String, Long> nonceUpdates = new LinkedHashMap<>();

    // 发送者 -> 修改前的下一个期望 nonce
    private Map<String, Long> previousNonces = new LinkedHashMap<>();

    private long fees;

    // 新发行量：CoinBase 输出 - 手续费；回滚时为负
    private long minted;

    // 提交后的账本状态版本
    private long stateVersion;
}
