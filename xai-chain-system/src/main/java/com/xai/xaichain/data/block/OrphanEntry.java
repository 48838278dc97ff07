package com.xai.xaichain.data.block;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 父区块未知的区块
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class OrphanEntry {

    private Block block;

    // 收到时间（毫秒）
    private long receivedAt;

    private String sourcePeer;
}
