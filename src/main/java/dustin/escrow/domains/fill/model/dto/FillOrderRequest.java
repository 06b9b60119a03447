package dustin.escrow.domains.fill.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 요청 DTO
 * Fill Order Request DTO
 *
 * 요청 금액이 잔량보다 크면 잔량으로 줄여 체결합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "체결 요청")
public class FillOrderRequest {

    @NotBlank(message = "orderId is required")
    @Schema(description = "주문 ID (64자리 hex)", required = true)
    private String orderId;

    @NotNull(message = "amount is required")
    @Schema(description = "요청 체결 금액", example = "200", required = true)
    private BigInteger amount;

    @Schema(description = "수취인 (정보용, 비어 있으면 호출자)", example = "bob")
    private String receiver;
}
