package dustin.escrow.domains.fee.service;

import java.math.BigInteger;

import org.springframework.stereotype.Component;

import dustin.escrow.shared.math.Amounts;

/**
 * 수수료 계산기
 * Fee Calculator
 *
 * 역할:
 * - 입금 총액(gross)에서 프로토콜 수수료와 에스크로 순액(net)을 계산
 * - fee = floor(gross * bps / 10000), net = gross - fee
 *
 * 수수료율 범위 검증은 설정 시점(ProtocolAdminService)에서만 수행합니다.
 */
@Component
public class FeeCalculator {

    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000L);

    public FeeSplit split(BigInteger gross, int feeRateBps) {
        Amounts.requireAmount(gross, "amount");
        BigInteger fee = Amounts.checkedMul(gross, BigInteger.valueOf(feeRateBps)).divide(BPS_DENOMINATOR);
        BigInteger net = Amounts.checkedSub(gross, fee);
        return new FeeSplit(net, fee);
    }
}
