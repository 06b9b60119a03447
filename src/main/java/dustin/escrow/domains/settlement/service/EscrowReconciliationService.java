package dustin.escrow.domains.settlement.service;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.escrow.config.EscrowProperties;
import dustin.escrow.domains.fee.model.entity.ProtocolState;
import dustin.escrow.domains.fee.service.ProtocolStateService;
import dustin.escrow.domains.fill.model.entity.Fill;
import dustin.escrow.domains.fill.repository.FillRepository;
import dustin.escrow.domains.order.model.entity.SwapOrder;
import dustin.escrow.domains.order.repository.SwapOrderRepository;
import dustin.escrow.domains.settlement.model.dto.ReconciliationResult;
import dustin.escrow.shared.ledger.EscrowLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 에스크로 원장 대사 서비스
 * Escrow Reconciliation Service
 *
 * 역할:
 * - 금고 계정 잔고가 아직 지급되지 않은 의무의 합계와 같은지 검증
 *
 * 검증 원칙:
 * ==========
 * 금고 잔고 = 누적 수수료
 *          + Σ (취소되지 않은 주문의 total - filled - refunded)
 *          + Σ (출금/환불되지 않은 체결의 fill_amount)
 *
 * 프로토콜 상태 락을 잡고 읽으므로 진행 중인 정산 작업과 섞이지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscrowReconciliationService {

    private final ProtocolStateService protocolStateService;
    private final SwapOrderRepository swapOrderRepository;
    private final FillRepository fillRepository;
    private final EscrowLedger escrowLedger;
    private final EscrowProperties properties;

    @Transactional
    public ReconciliationResult reconcile() {
        ProtocolState state = protocolStateService.lockForUpdate();

        List<SwapOrder> openOrders = swapOrderRepository.findByCancelledFalse();
        BigInteger unclaimed = BigInteger.ZERO;
        for (SwapOrder order : openOrders) {
            unclaimed = unclaimed.add(order.unclaimedAmount());
        }

        List<Fill> openFills = fillRepository.findByWithdrawnFalseAndRefundedFalse();
        BigInteger openFillAmount = BigInteger.ZERO;
        for (Fill fill : openFills) {
            openFillAmount = openFillAmount.add(fill.getFillAmount());
        }

        BigInteger expected = state.getAccumulatedFees().add(unclaimed).add(openFillAmount);
        BigInteger vaultBalance = escrowLedger.balanceOf(properties.getVaultAccount());
        BigInteger difference = vaultBalance.subtract(expected);

        ReconciliationResult result = ReconciliationResult.builder()
                .vaultAccount(properties.getVaultAccount())
                .vaultBalance(vaultBalance.toString())
                .expectedBalance(expected.toString())
                .accumulatedFees(state.getAccumulatedFees().toString())
                .unclaimedOrderAmount(unclaimed.toString())
                .openFillAmount(openFillAmount.toString())
                .openOrders(openOrders.size())
                .openFills(openFills.size())
                .difference(difference.toString())
                .matched(difference.signum() == 0)
                .checkedAt(LocalDateTime.now())
                .build();

        if (result.isMatched()) {
            log.info("[EscrowReconciliationService] 대사 일치: vault={}, openOrders={}, openFills={}",
                    vaultBalance, openOrders.size(), openFills.size());
        } else {
            log.error("[EscrowReconciliationService] 대사 불일치: vault={}, expected={}, difference={}",
                    vaultBalance, expected, difference);
        }
        return result;
    }
}
