package dustin.escrow.domains.fee.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수수료율 변경 요청 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "수수료율 변경 요청 (admin 전용)")
public class UpdateFeeRateRequest {

    @NotNull(message = "feeRateBps is required")
    @Schema(description = "새 수수료율 (bps, 0 ~ 1000)", example = "50", required = true)
    private Integer feeRateBps;
}
