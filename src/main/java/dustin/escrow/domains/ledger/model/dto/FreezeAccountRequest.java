package dustin.escrow.domains.ledger.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정 동결 요청 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계정 동결/해제 요청 (admin 전용)")
public class FreezeAccountRequest {

    @NotBlank(message = "accountId is required")
    @Schema(description = "계정 ID", example = "bob", required = true)
    private String accountId;

    @Schema(description = "true면 동결, false면 해제", example = "true")
    private boolean frozen;
}
