package dustin.escrow.domains.fee.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * admin 변경 요청 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "admin 변경 요청 (admin 전용)")
public class UpdateAdminRequest {

    @NotBlank(message = "newAdmin is required")
    @Schema(description = "새 admin 계정", example = "treasury", required = true)
    private String newAdmin;
}
