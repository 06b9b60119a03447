package dustin.escrow.shared.ledger;

import java.math.BigInteger;

import lombok.Builder;
import lombok.Value;

/**
 * 호출 컨텍스트
 * Ledger Call Context
 *
 * 하나의 작업 호출에 대해 호스트가 제공하는 값들입니다.
 * 시간/높이는 호출 시점에 한 번만 읽고 작업 중에 다시 읽지 않습니다.
 *
 * - caller: 호출자 식별자 (JWT subject)
 * - blockNumber: 현재 블록 높이 (timelock 비교 기준)
 * - timestamp: 현재 원장 타임스탬프 (초)
 * - attachedValue: 호출에 첨부된 금액 (주문 생성에서만 사용)
 */
@Value
@Builder
public class LedgerCall {

    String caller;

    long blockNumber;

    long timestamp;

    @Builder.Default
    BigInteger attachedValue = BigInteger.ZERO;

    public static LedgerCall of(String caller, LedgerClock clock) {
        return LedgerCall.builder()
                .caller(caller)
                .blockNumber(clock.currentBlock())
                .timestamp(clock.currentTimestamp())
                .build();
    }

    public static LedgerCall of(String caller, LedgerClock clock, BigInteger attachedValue) {
        return LedgerCall.builder()
                .caller(caller)
                .blockNumber(clock.currentBlock())
                .timestamp(clock.currentTimestamp())
                .attachedValue(attachedValue != null ? attachedValue : BigInteger.ZERO)
                .build();
    }
}
