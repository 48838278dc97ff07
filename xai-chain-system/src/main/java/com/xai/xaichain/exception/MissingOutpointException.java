package com.xai.xaichain.exception;

import com.xai.xaichain.data.transaction.Outpoint;
import lombok.Getter;

/**
 * 花费了不存在或已花费的输出：双花，或区块应用顺序错误
 */
@Getter
public class MissingOutpointException extends ConsensusViolationException {

    private static final long serialVersionUID = 1L;

    private final Outpoint outpoint;

    public MissingOutpointException(Outpoint outpoint) {
        super(RejectReason.MISSING_OUTPOINT, "引用的输出不存在或已花费: " + outpoint);
        this.outpoint = outpoint;
    }
}
