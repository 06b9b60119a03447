package dustin.escrow.domains.address.model.dto;

import dustin.escrow.domains.address.model.entity.CrossChainAddressType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상대 체인 주소 등록 요청 DTO
 * Map Address Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "상대 체인 주소 등록 요청")
public class MapAddressRequest {

    @NotNull(message = "addressType is required")
    @Schema(description = "주소 유형: ETHEREUM(20바이트), SUBSTRATE(32바이트), RAW", example = "ETHEREUM", required = true)
    private CrossChainAddressType addressType;

    @NotBlank(message = "address is required")
    @Schema(description = "주소 (hex)", example = "0x742d35cc6634c0532925a3b844bc454e4438f44e", required = true)
    private String address;
}
