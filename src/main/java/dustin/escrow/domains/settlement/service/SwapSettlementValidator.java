package dustin.escrow.domains.settlement.service;

import java.math.BigInteger;

import org.springframework.stereotype.Component;

import dustin.escrow.domains.fill.model.entity.Fill;
import dustin.escrow.domains.order.model.entity.SwapOrder;
import dustin.escrow.shared.crypto.Hashes;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;

/**
 * 스왑 정산 검증기
 * Swap Settlement Validator
 *
 * 역할:
 * - 정산 작업의 사전 조건 검증 (상태를 읽기만 하고 변경하지 않음)
 * - 각 검증은 실패 시 고유한 EscrowErrorCode로 EscrowException을 던짐
 *
 * 검증 항목:
 * =========
 * 1. 주문 생성: timelock 범위, 체인 쌍, 최소 체결 금액, 최대 체결 횟수, 입금액
 * 2. 체결: 주문 상태, 만료, 체결 가능 횟수, 체결 금액 정책 (clamp / dust / 부분 체결)
 * 3. 출금: taker 권한, 체결 상태, 만료 전, secret 일치
 * 4. 환불: maker 권한, 체결 상태, 만료 후
 */
@Component
public class SwapSettlementValidator {

    /**
     * timelock 범위 검증
     * timelock > now, min <= timelock - now <= max
     */
    public void validateTimelock(long timelock, long now, long minTimelock, long maxTimelock) {
        if (timelock <= now) {
            throw new EscrowException(EscrowErrorCode.INVALID_TIMELOCK,
                    "timelock " + timelock + " must be after current block " + now);
        }
        long duration = timelock - now;
        if (duration < minTimelock) {
            throw new EscrowException(EscrowErrorCode.TIMELOCK_TOO_SHORT,
                    "timelock duration " + duration + " < min " + minTimelock);
        }
        if (duration > maxTimelock) {
            throw new EscrowException(EscrowErrorCode.TIMELOCK_TOO_LONG,
                    "timelock duration " + duration + " > max " + maxTimelock);
        }
    }

    public void validateChainPair(long sourceChain, long destChain) {
        if (sourceChain == destChain) {
            throw new EscrowException(EscrowErrorCode.INVALID_CHAIN_PAIR,
                    "source and destination chain are both " + sourceChain);
        }
    }

    /**
     * 주문 생성 시 체결 금액 설정 검증
     *
     * @param minFillAmount 최소 체결 금액
     * @param totalAmount 수수료 차감 후 에스크로 순액
     * @param maxFills 최대 체결 횟수
     */
    public void validateFillBounds(BigInteger minFillAmount, BigInteger totalAmount, int maxFills) {
        if (minFillAmount.signum() <= 0 || minFillAmount.compareTo(totalAmount) > 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_MIN_FILL_AMOUNT,
                    "min fill amount " + minFillAmount + " must be in (0, " + totalAmount + "]");
        }
        if (maxFills <= 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_MAX_FILLS);
        }
    }

    /**
     * 첨부 금액 검증 (0보다 크고 주문 금액 이상)
     */
    public void validateDeposit(BigInteger attachedValue, BigInteger grossAmount) {
        if (attachedValue.signum() <= 0 || attachedValue.compareTo(grossAmount) < 0) {
            throw new EscrowException(EscrowErrorCode.INSUFFICIENT_DEPOSIT,
                    "attached value " + attachedValue + " does not cover " + grossAmount);
        }
    }

    /**
     * 체결 가능 여부 검증 (검사 순서 고정)
     */
    public void validateFillEligibility(SwapOrder order, BigInteger requestedAmount, long now) {
        if (Boolean.TRUE.equals(order.getCancelled())) {
            throw new EscrowException(EscrowErrorCode.ORDER_CANCELLED);
        }
        if (now >= order.getTimelock()) {
            throw new EscrowException(EscrowErrorCode.TIMELOCK_EXPIRED,
                    "order expired at block " + order.getTimelock());
        }
        if (order.isCompleted() || order.unclaimedAmount().signum() <= 0) {
            throw new EscrowException(EscrowErrorCode.ORDER_COMPLETED);
        }
        if (order.getCurrentFills() >= order.getMaxFills()) {
            throw new EscrowException(EscrowErrorCode.MAX_FILLS_REACHED);
        }
        if (requestedAmount.signum() <= 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_FILL_AMOUNT);
        }
    }

    /**
     * 실제 체결 금액 결정
     * Resolve actual fill amount
     *
     * 1. 요청 금액이 잔량보다 크면 잔량으로 줄임 (거부하지 않음)
     * 2. 줄인 금액이 최소 체결 금액보다 작고 잔량이 최소 체결 금액 이상이면 거부
     *    (잔량 자체가 최소 금액보다 작은 마지막 체결만 허용)
     * 3. 부분 체결 불가 주문은 잔량 전체를 체결해야 함
     *    잔량 이상을 요청해 잔량으로 줄어든 경우는 전체 체결로 간주
     *
     * @return 실제 체결 금액
     */
    public BigInteger resolveFillAmount(SwapOrder order, BigInteger requestedAmount) {
        BigInteger remaining = order.unclaimedAmount();
        BigInteger fillAmount = requestedAmount.min(remaining);

        if (fillAmount.compareTo(order.getMinFillAmount()) < 0
                && remaining.compareTo(order.getMinFillAmount()) >= 0) {
            throw new EscrowException(EscrowErrorCode.FILL_AMOUNT_TOO_SMALL,
                    "fill amount " + fillAmount + " < min " + order.getMinFillAmount());
        }
        if (!Boolean.TRUE.equals(order.getAllowPartialFills()) && fillAmount.compareTo(remaining) < 0) {
            throw new EscrowException(EscrowErrorCode.PARTIAL_FILLS_NOT_ALLOWED,
                    "fill amount " + fillAmount + " must equal remaining " + remaining);
        }
        return fillAmount;
    }

    public void validateFillOpen(Fill fill) {
        if (!fill.isOpen()) {
            throw new EscrowException(EscrowErrorCode.FILL_ALREADY_SETTLED,
                    "fill " + fill.getFillId() + " is already settled");
        }
    }

    /**
     * 출금 권한/시점 검증
     */
    public void validateWithdrawal(Fill fill, SwapOrder order, String caller, long now) {
        if (!fill.getTaker().equals(caller)) {
            throw new EscrowException(EscrowErrorCode.UNAUTHORIZED_WITHDRAW);
        }
        validateFillOpen(fill);
        if (now >= order.getTimelock()) {
            throw new EscrowException(EscrowErrorCode.TIMELOCK_EXPIRED,
                    "order expired at block " + order.getTimelock());
        }
    }

    /**
     * 환불 권한/시점 검증
     */
    public void validateRefund(Fill fill, SwapOrder order, String caller, long now) {
        if (!order.getMaker().equals(caller)) {
            throw new EscrowException(EscrowErrorCode.UNAUTHORIZED_REFUND);
        }
        validateFillOpen(fill);
        if (now < order.getTimelock()) {
            throw new EscrowException(EscrowErrorCode.TIMELOCK_NOT_EXPIRED,
                    "order expires at block " + order.getTimelock());
        }
    }

    /**
     * secret 검증: sha256(preimage) == hashlock (상수 시간 비교)
     */
    public void validateSecret(byte[] preimage, String hashlockHex) {
        byte[] hashlock = Hashes.parseHash(hashlockHex, "hashlock");
        if (!Hashes.constantTimeEquals(Hashes.sha256(preimage), hashlock)) {
            throw new EscrowException(EscrowErrorCode.SECRET_MISMATCH);
        }
    }
}
