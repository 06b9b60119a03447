package dustin.escrow.domains.settlement.scheduler;

import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.escrow.domains.settlement.model.dto.ReconciliationResult;
import dustin.escrow.domains.settlement.service.EscrowReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 에스크로 대사 스케줄러
 * Escrow Reconciliation Scheduler
 *
 * 역할:
 * - escrow.reconciliation.cron 주기로 금고 잔고 대사 실행
 *
 * 재시도 전략:
 * ===========
 * - 최대 3회 재시도
 * - 지수 백오프: 2초 → 4초
 * - RuntimeException 발생 시에만 재시도 (불일치 자체는 재시도하지 않음)
 * - 재시도 실패 시 recover 메서드 호출
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscrowReconciliationScheduler {

    private final EscrowReconciliationService escrowReconciliationService;

    @Scheduled(cron = "${escrow.reconciliation.cron:0 */10 * * * ?}")
    @Retryable(
            retryFor = {RuntimeException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 2000, multiplier = 2)
    )
    public void reconcile() {
        log.info("[EscrowReconciliationScheduler] 대사 시작");
        ReconciliationResult result = escrowReconciliationService.reconcile();
        log.info("[EscrowReconciliationScheduler] 대사 완료: matched={}, difference={}",
                result.isMatched(), result.getDifference());
    }

    /**
     * 재시도 모두 실패 시 호출
     * Called after all retries fail
     */
    @Recover
    public void recover(RuntimeException e) {
        log.error("[EscrowReconciliationScheduler] 대사 최종 실패 (재시도 소진): {}", e.getMessage(), e);
    }
}
