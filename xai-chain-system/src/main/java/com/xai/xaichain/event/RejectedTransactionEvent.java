package com.xai.xaichain.event;

import com.xai.xaichain.exception.RejectReason;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RejectedTransactionEvent {

    private String txId;

    private RejectReason reason;

    private String message;

    // 本地提交为 null
    private String sourcePeer;
}
