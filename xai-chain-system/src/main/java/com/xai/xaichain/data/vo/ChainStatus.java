package com.xai.xaichain.data.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 链状态查询结果
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ChainStatus {

    private long height;

    private String tipHash;

    private BigInteger chainWork;

    private String difficultyTarget;

    private long medianTimePast;

    private long totalSupply;

    private long utxoCount;

    private long stateVersion;

    private int mempoolSize;

    private int orphanBlockCount;

    private int tipCount;

    private long latestCheckpointHeight;

    private boolean halted;
}
