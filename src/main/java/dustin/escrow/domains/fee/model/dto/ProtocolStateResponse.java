package dustin.escrow.domains.fee.model.dto;

import dustin.escrow.domains.fee.model.entity.ProtocolState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프로토콜 상태 응답 DTO
 * Protocol State Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "프로토콜 상태")
public class ProtocolStateResponse {

    @Schema(description = "admin 계정", example = "admin")
    private String admin;

    @Schema(description = "수수료율 (bps)", example = "30")
    private int feeRateBps;

    @Schema(description = "누적 수수료 (10진 문자열)", example = "3")
    private String accumulatedFees;

    @Schema(description = "최소 timelock (블록)", example = "100")
    private long minTimelock;

    @Schema(description = "최대 timelock (블록)", example = "14400")
    private long maxTimelock;

    private long orderCounter;

    private long fillCounter;

    public static ProtocolStateResponse from(ProtocolState state) {
        return ProtocolStateResponse.builder()
                .admin(state.getAdmin())
                .feeRateBps(state.getFeeRateBps())
                .accumulatedFees(state.getAccumulatedFees().toString())
                .minTimelock(state.getMinTimelock())
                .maxTimelock(state.getMaxTimelock())
                .orderCounter(state.getOrderCounter())
                .fillCounter(state.getFillCounter())
                .build();
    }
}
