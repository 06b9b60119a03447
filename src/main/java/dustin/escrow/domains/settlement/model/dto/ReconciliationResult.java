package dustin.escrow.domains.settlement.model.dto;

import java.time.LocalDateTime;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 원장 대사 결과
 * Ledger Reconciliation Result
 *
 * expected = 누적 수수료 + 미취소 주문의 미할당 잔량 합계 + 미종료 체결 금액 합계
 * difference = vaultBalance - expected (음수면 금고 부족)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "원장 대사 결과")
public class ReconciliationResult {

    @Schema(description = "금고 계정")
    private String vaultAccount;

    @Schema(description = "금고 실제 잔고")
    private String vaultBalance;

    @Schema(description = "기대 잔고 (미지급 의무 합계)")
    private String expectedBalance;

    private String accumulatedFees;

    private String unclaimedOrderAmount;

    private String openFillAmount;

    private long openOrders;

    private long openFills;

    @Schema(description = "차이 (실제 - 기대)")
    private String difference;

    @Schema(description = "일치 여부")
    private boolean matched;

    private LocalDateTime checkedAt;
}
