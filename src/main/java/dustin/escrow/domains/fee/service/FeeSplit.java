package dustin.escrow.domains.fee.service;

import java.math.BigInteger;

import lombok.Value;

/**
 * 수수료 분리 결과
 * net + fee == gross
 */
@Value
public class FeeSplit {
    BigInteger net;
    BigInteger fee;
}
