package dustin.escrow.domains.settlement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.escrow.domains.fill.model.entity.Fill;
import dustin.escrow.domains.order.model.entity.SwapOrder;
import dustin.escrow.domains.settlement.service.SwapSettlementValidator;
import dustin.escrow.shared.crypto.Hashes;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;

/**
 * 정산 검증기 테스트
 * Swap Settlement Validator Test
 *
 * 테스트 항목:
 * 1. timelock 범위
 * 2. 체결 가능 여부 검사 순서
 * 3. 체결 금액 결정 (clamp, 최소 금액, 부분 체결)
 * 4. 출금/환불 권한 및 시점
 * 5. secret 검증
 */
class SwapSettlementValidatorTest {

    private final SwapSettlementValidator validator = new SwapSettlementValidator();

    private static SwapOrder order(long total, long filled, long refunded, long min, boolean partial) {
        return SwapOrder.builder()
                .orderId("00".repeat(32))
                .maker("alice")
                .totalAmount(BigInteger.valueOf(total))
                .filledAmount(BigInteger.valueOf(filled))
                .refundedAmount(BigInteger.valueOf(refunded))
                .minFillAmount(BigInteger.valueOf(min))
                .hashlock(Hashes.toHex(Hashes.sha256("secret".getBytes(StandardCharsets.UTF_8))))
                .timelock(1500L)
                .cancelled(false)
                .allowPartialFills(partial)
                .maxFills(3)
                .currentFills(0)
                .build();
    }

    private static Fill fill(String taker) {
        return Fill.builder()
                .fillId("11".repeat(32))
                .taker(taker)
                .fillAmount(BigInteger.valueOf(200))
                .withdrawn(false)
                .refunded(false)
                .build();
    }

    private static void assertCode(org.assertj.core.api.ThrowableAssert.ThrowingCallable call, EscrowErrorCode code) {
        assertThatThrownBy(call)
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(code);
    }

    @Test
    @DisplayName("timelock: 현재 이하, 최소 미만, 최대 초과 거부")
    void testTimelock() {
        assertCode(() -> validator.validateTimelock(1000, 1000, 100, 14400), EscrowErrorCode.INVALID_TIMELOCK);
        assertCode(() -> validator.validateTimelock(1099, 1000, 100, 14400), EscrowErrorCode.TIMELOCK_TOO_SHORT);
        assertCode(() -> validator.validateTimelock(15401, 1000, 100, 14400), EscrowErrorCode.TIMELOCK_TOO_LONG);

        assertThatCode(() -> validator.validateTimelock(1100, 1000, 100, 14400)).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateTimelock(15400, 1000, 100, 14400)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("주문 생성 파라미터: 체인 쌍, 최소 체결 금액, 최대 체결 횟수, 입금액")
    void testCreateParameters() {
        assertCode(() -> validator.validateChainPair(1, 1), EscrowErrorCode.INVALID_CHAIN_PAIR);
        assertCode(() -> validator.validateFillBounds(BigInteger.ZERO, BigInteger.TEN, 1),
                EscrowErrorCode.INVALID_MIN_FILL_AMOUNT);
        assertCode(() -> validator.validateFillBounds(BigInteger.valueOf(11), BigInteger.TEN, 1),
                EscrowErrorCode.INVALID_MIN_FILL_AMOUNT);
        assertCode(() -> validator.validateFillBounds(BigInteger.ONE, BigInteger.TEN, 0),
                EscrowErrorCode.INVALID_MAX_FILLS);
        assertCode(() -> validator.validateDeposit(BigInteger.ZERO, BigInteger.ZERO),
                EscrowErrorCode.INSUFFICIENT_DEPOSIT);
        assertCode(() -> validator.validateDeposit(BigInteger.valueOf(999), BigInteger.valueOf(1000)),
                EscrowErrorCode.INSUFFICIENT_DEPOSIT);

        assertThatCode(() -> validator.validateFillBounds(BigInteger.TEN, BigInteger.TEN, 1)).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateDeposit(BigInteger.valueOf(1001), BigInteger.valueOf(1000)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("체결 가능 여부: 취소가 만료보다 먼저 검사됨")
    void testEligibilityOrder() {
        SwapOrder cancelledAndExpired = order(997, 0, 0, 100, true);
        cancelledAndExpired.setCancelled(true);
        assertCode(() -> validator.validateFillEligibility(cancelledAndExpired, BigInteger.TEN, 2000),
                EscrowErrorCode.ORDER_CANCELLED);

        assertCode(() -> validator.validateFillEligibility(order(997, 0, 0, 100, true), BigInteger.TEN, 1500),
                EscrowErrorCode.TIMELOCK_EXPIRED);
        assertCode(() -> validator.validateFillEligibility(order(997, 997, 0, 100, true), BigInteger.TEN, 1000),
                EscrowErrorCode.ORDER_COMPLETED);
        // 환불로 잔량이 소진된 경우
        assertCode(() -> validator.validateFillEligibility(order(997, 797, 200, 100, true), BigInteger.TEN, 1000),
                EscrowErrorCode.ORDER_COMPLETED);

        SwapOrder full = order(997, 0, 0, 100, true);
        full.setCurrentFills(3);
        assertCode(() -> validator.validateFillEligibility(full, BigInteger.TEN, 1000),
                EscrowErrorCode.MAX_FILLS_REACHED);

        assertCode(() -> validator.validateFillEligibility(order(997, 0, 0, 100, true), BigInteger.ZERO, 1000),
                EscrowErrorCode.INVALID_FILL_AMOUNT);
    }

    @Test
    @DisplayName("체결 금액: 잔량 초과 요청은 잔량으로 줄임")
    void testClamp() {
        SwapOrder order = order(997, 500, 0, 100, true);

        assertThat(validator.resolveFillAmount(order, BigInteger.valueOf(10_000))).isEqualTo(BigInteger.valueOf(497));
        assertThat(validator.resolveFillAmount(order, BigInteger.valueOf(200))).isEqualTo(BigInteger.valueOf(200));
    }

    @Test
    @DisplayName("체결 금액: 최소 미만은 잔량이 최소 이상이면 거부, 마지막 잔량은 허용")
    void testDustRule() {
        assertCode(() -> validator.resolveFillAmount(order(997, 0, 0, 100, true), BigInteger.valueOf(99)),
                EscrowErrorCode.FILL_AMOUNT_TOO_SMALL);

        // 잔량 == 최소 금액이면 최소 미만 요청은 거부
        assertCode(() -> validator.resolveFillAmount(order(997, 897, 0, 100, true), BigInteger.valueOf(50)),
                EscrowErrorCode.FILL_AMOUNT_TOO_SMALL);

        // 잔량 47 < 최소 100
        assertThat(validator.resolveFillAmount(order(997, 950, 0, 100, true), BigInteger.valueOf(10)))
                .isEqualTo(BigInteger.TEN);
    }

    @Test
    @DisplayName("부분 체결 불가: 잔량 미만 거부, 잔량 이상 요청은 전체 체결")
    void testPartialFillsNotAllowed() {
        SwapOrder order = order(997, 0, 0, 100, false);

        assertCode(() -> validator.resolveFillAmount(order, BigInteger.valueOf(500)),
                EscrowErrorCode.PARTIAL_FILLS_NOT_ALLOWED);
        assertThat(validator.resolveFillAmount(order, BigInteger.valueOf(997))).isEqualTo(BigInteger.valueOf(997));
        assertThat(validator.resolveFillAmount(order, BigInteger.valueOf(5000))).isEqualTo(BigInteger.valueOf(997));
    }

    @Test
    @DisplayName("출금: taker 권한, 미정산, 만료 전")
    void testWithdrawal() {
        SwapOrder order = order(997, 200, 0, 100, true);

        assertCode(() -> validator.validateWithdrawal(fill("bob"), order, "mallory", 1000),
                EscrowErrorCode.UNAUTHORIZED_WITHDRAW);
        assertCode(() -> validator.validateWithdrawal(fill("bob"), order, "bob", 1500),
                EscrowErrorCode.TIMELOCK_EXPIRED);

        Fill settled = fill("bob");
        settled.setWithdrawn(true);
        assertCode(() -> validator.validateWithdrawal(settled, order, "bob", 1000),
                EscrowErrorCode.FILL_ALREADY_SETTLED);

        assertThatCode(() -> validator.validateWithdrawal(fill("bob"), order, "bob", 1499)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("환불: maker 권한, 미정산, 만료 후")
    void testRefund() {
        SwapOrder order = order(997, 200, 0, 100, true);

        assertCode(() -> validator.validateRefund(fill("bob"), order, "bob", 1500),
                EscrowErrorCode.UNAUTHORIZED_REFUND);
        assertCode(() -> validator.validateRefund(fill("bob"), order, "alice", 1499),
                EscrowErrorCode.TIMELOCK_NOT_EXPIRED);

        Fill refunded = fill("bob");
        refunded.setRefunded(true);
        assertCode(() -> validator.validateRefund(refunded, order, "alice", 1500),
                EscrowErrorCode.FILL_ALREADY_SETTLED);

        assertThatCode(() -> validator.validateRefund(fill("bob"), order, "alice", 1500)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("secret: sha256(preimage) == hashlock")
    void testSecret() {
        String hashlock = Hashes.toHex(Hashes.sha256("secret".getBytes(StandardCharsets.UTF_8)));

        assertThatCode(() -> validator.validateSecret("secret".getBytes(StandardCharsets.UTF_8), hashlock))
                .doesNotThrowAnyException();
        assertCode(() -> validator.validateSecret("wrong".getBytes(StandardCharsets.UTF_8), hashlock),
                EscrowErrorCode.SECRET_MISMATCH);
    }
}
