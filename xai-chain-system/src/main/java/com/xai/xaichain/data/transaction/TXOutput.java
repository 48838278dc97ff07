package com.xai.xaichain.data.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交易输出
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TXOutput {

    /**
     * 金额，最小单位（1币 = 1e8）
     */
    private long value;

    /**
     * 接收者地址（公钥哈希）
     */
    private String address;
}
