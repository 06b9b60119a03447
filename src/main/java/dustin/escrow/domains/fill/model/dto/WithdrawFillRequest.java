package dustin.escrow.domains.fill.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 출금 요청 DTO
 * Withdraw Fill Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "secret 공개 출금 요청")
public class WithdrawFillRequest {

    @NotBlank(message = "preimage is required")
    @Schema(description = "32바이트 secret (hex)", required = true,
            example = "7365637265742d7365637265742d7365637265742d7365637265742d73656372")
    private String preimage;
}
