package dustin.escrow.domains.ledger.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정 충전 요청 DTO
 * Credit Account Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계정 충전 요청 (admin 전용)")
public class CreditAccountRequest {

    @NotBlank(message = "accountId is required")
    @Schema(description = "충전할 계정 ID", example = "alice", required = true)
    private String accountId;

    @NotNull(message = "amount is required")
    @Schema(description = "충전 금액", example = "1000000", required = true)
    private BigInteger amount;
}
