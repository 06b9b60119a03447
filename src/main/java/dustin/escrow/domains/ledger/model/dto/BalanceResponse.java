package dustin.escrow.domains.ledger.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 원장 잔고 응답 DTO
 * Ledger Balance Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "원장 계정 잔고")
public class BalanceResponse {

    @Schema(description = "계정 ID", example = "alice")
    private String accountId;

    /**
     * 잔고 (u128, 정밀도 손실 방지를 위해 문자열)
     */
    @Schema(description = "잔고 (10진 문자열)", example = "1000")
    private String balance;

    @Schema(description = "동결 여부", example = "false")
    private boolean frozen;
}
