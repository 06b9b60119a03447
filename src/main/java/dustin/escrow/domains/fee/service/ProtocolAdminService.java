package dustin.escrow.domains.fee.service;

import java.math.BigInteger;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import dustin.escrow.domains.fee.model.dto.ProtocolStateResponse;
import dustin.escrow.domains.fee.model.entity.ProtocolState;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;
import dustin.escrow.shared.kafka.model.FeesSweptEvent;
import dustin.escrow.shared.ledger.EscrowLedger;
import dustin.escrow.shared.ledger.LedgerCall;
import dustin.escrow.shared.math.Amounts;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로토콜 관리 서비스
 * Protocol Admin Service
 *
 * 역할:
 * - 수수료율 변경, admin 변경 (admin 전용)
 * - 누적 수수료 출금 (admin 전용, 보상 트랜잭션 포함)
 */
@Slf4j
@Service
public class ProtocolAdminService {

    public static final int MAX_FEE_RATE_BPS = 1000;

    private final ProtocolStateService protocolStateService;
    private final EscrowLedger escrowLedger;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    /**
     * 생성자: TransactionTemplate 초기화
     * Constructor: Initialize TransactionTemplate
     */
    public ProtocolAdminService(
            ProtocolStateService protocolStateService,
            EscrowLedger escrowLedger,
            ApplicationEventPublisher eventPublisher,
            PlatformTransactionManager transactionManager) {
        this.protocolStateService = protocolStateService;
        this.escrowLedger = escrowLedger;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Transactional(readOnly = true)
    public ProtocolStateResponse getProtocolState() {
        return ProtocolStateResponse.from(protocolStateService.getState());
    }

    /**
     * 수수료율 변경
     * Set fee rate
     *
     * @param call 호출 컨텍스트 (caller = admin)
     * @param feeRateBps 새 수수료율 (0 ~ 1000 bps)
     * @throws EscrowException NOT_ADMIN, INVALID_FEE_RATE
     */
    @Transactional
    public ProtocolStateResponse setFeeRate(LedgerCall call, int feeRateBps) {
        ProtocolState state = protocolStateService.lockForUpdate();
        requireAdmin(state, call);
        if (feeRateBps < 0 || feeRateBps > MAX_FEE_RATE_BPS) {
            throw new EscrowException(EscrowErrorCode.INVALID_FEE_RATE,
                    "fee rate " + feeRateBps + " bps is outside [0, " + MAX_FEE_RATE_BPS + "]");
        }

        int previous = state.getFeeRateBps();
        state.setFeeRateBps(feeRateBps);
        log.info("[ProtocolAdminService] 수수료율 변경: {} -> {} bps", previous, feeRateBps);
        return ProtocolStateResponse.from(state);
    }

    /**
     * admin 변경
     * Update admin
     */
    @Transactional
    public ProtocolStateResponse updateAdmin(LedgerCall call, String newAdmin) {
        ProtocolState state = protocolStateService.lockForUpdate();
        requireAdmin(state, call);
        if (newAdmin == null || newAdmin.isBlank()) {
            throw new EscrowException(EscrowErrorCode.INVALID_ACCOUNT, "new admin must not be blank");
        }

        String previous = state.getAdmin();
        state.setAdmin(newAdmin);
        log.info("[ProtocolAdminService] admin 변경: {} -> {}", previous, newAdmin);
        return ProtocolStateResponse.from(state);
    }

    /**
     * 누적 수수료 출금
     * Sweep accumulated fees to admin
     *
     * 처리 과정:
     * 1. 누적 수수료를 0으로 만들고 커밋 (트랜잭션 1)
     * 2. 금고에서 admin에게 지급 (트랜잭션 2)
     * 3. 지급 실패 시 출금액을 누적 수수료에 다시 더함 (보상 트랜잭션) 후 오류 전파
     *
     * @param call 호출 컨텍스트 (caller = admin)
     * @return 출금된 금액
     * @throws EscrowException NOT_ADMIN, NO_FEES_ACCRUED, TRANSFER_FAILED
     */
    public BigInteger sweepFees(LedgerCall call) {
        // ============================================
        // 1. 누적 수수료 차감 (트랜잭션 내, 명시적 커밋)
        // ============================================
        BigInteger amount = transactionTemplate.execute(status -> {
            ProtocolState state = protocolStateService.lockForUpdate();
            requireAdmin(state, call);
            BigInteger accumulated = state.getAccumulatedFees();
            if (accumulated.signum() == 0) {
                throw new EscrowException(EscrowErrorCode.NO_FEES_ACCRUED);
            }
            state.setAccumulatedFees(BigInteger.ZERO);
            return accumulated;
        });
        String admin = call.getCaller();

        // ============================================
        // 2. admin에게 지급
        // ============================================
        try {
            escrowLedger.release(admin, amount);
        } catch (RuntimeException e) {
            // ============================================
            // 3. 보상 트랜잭션: 누적 수수료 복구
            // ============================================
            try {
                restoreFees(amount);
            } catch (RuntimeException restoreError) {
                log.error("[ProtocolAdminService] 누적 수수료 복구 실패: admin={}, amount={}, cause={}",
                        admin, amount, e.getMessage(), restoreError);
                restoreError.addSuppressed(e);
                throw restoreError;
            }
            log.warn("[ProtocolAdminService] 수수료 출금 실패, 누적 수수료 복구: admin={}, amount={}, error={}",
                    admin, amount, e.getMessage());
            throw e;
        }

        log.info("[ProtocolAdminService] 수수료 출금 완료: admin={}, amount={}", admin, amount);
        eventPublisher.publishEvent(FeesSweptEvent.builder()
                .admin(admin)
                .amount(amount.toString())
                .blockNumber(call.getBlockNumber())
                .build());
        return amount;
    }

    private void restoreFees(BigInteger amount) {
        transactionTemplate.executeWithoutResult(status -> {
            ProtocolState state = protocolStateService.lockForUpdate();
            state.setAccumulatedFees(Amounts.checkedAdd(state.getAccumulatedFees(), amount));
        });
    }

    private void requireAdmin(ProtocolState state, LedgerCall call) {
        if (!state.getAdmin().equals(call.getCaller())) {
            throw new EscrowException(EscrowErrorCode.NOT_ADMIN);
        }
    }
}
