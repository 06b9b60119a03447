package dustin.escrow.domains.order.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 요청 DTO
 * Create Order Request DTO
 *
 * 역할:
 * - maker가 hashlock/timelock 아래 금액을 잠글 때 전달하는 요청 데이터
 * - amount는 수수료 차감 전 총액, 호출에 첨부된 금액(X-Attached-Value)이 이 값 이상이어야 함
 *
 * 예시:
 * - amount=1000, 수수료율 30bps → fee=3, 에스크로 순액 997
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "주문 생성 요청")
public class CreateOrderRequest {

    /**
     * 입금 총액 (수수료 포함)
     */
    @NotNull(message = "amount is required")
    @Schema(description = "입금 총액 (수수료 차감 전)", example = "1000", required = true)
    private BigInteger amount;

    /**
     * 최소 체결 금액 (에스크로 순액 이하)
     */
    @NotNull(message = "minFillAmount is required")
    @Schema(description = "최소 체결 금액", example = "100", required = true)
    private BigInteger minFillAmount;

    @NotBlank(message = "hashlock is required")
    @Schema(description = "SHA-256(secret), 32바이트 hex", required = true,
            example = "2bb80d537b1da3e38bd30361aa855686bde0eacd7162fef6a25fe97bf527a25b")
    private String hashlock;

    /**
     * 만료 블록 높이 (절대값)
     */
    @NotNull(message = "timelock is required")
    @Schema(description = "만료 블록 높이", example = "1200", required = true)
    private Long timelock;

    @NotBlank(message = "swapId is required")
    @Schema(description = "스왑 ID, 32바이트 hex", required = true,
            example = "0101010101010101010101010101010101010101010101010101010101010101")
    private String swapId;

    @NotNull(message = "sourceChain is required")
    @Min(value = 0, message = "sourceChain must be a u32")
    @Max(value = 4294967295L, message = "sourceChain must be a u32")
    @Schema(description = "출발 체인 ID", example = "1", required = true)
    private Long sourceChain;

    @NotNull(message = "destChain is required")
    @Min(value = 0, message = "destChain must be a u32")
    @Max(value = 4294967295L, message = "destChain must be a u32")
    @Schema(description = "도착 체인 ID", example = "2", required = true)
    private Long destChain;

    /**
     * 단위당 목적 체인 금액 (1e12 스케일, 정보용)
     */
    @NotNull(message = "destAmountPerUnit is required")
    @Schema(description = "단위당 목적 체인 금액 (1e12 스케일)", example = "2000000000000", required = true)
    private BigInteger destAmountPerUnit;

    @Builder.Default
    @Schema(description = "부분 체결 허용 여부", example = "true", defaultValue = "true")
    private Boolean allowPartialFills = true;

    @NotNull(message = "maxFills is required")
    @Schema(description = "최대 체결 횟수", example = "10", required = true)
    private Integer maxFills;

    @Schema(description = "maker의 상대 체인 주소 (hex, 선택)", example = "0x1111111111111111111111111111111111111111")
    private String senderCrossAddress;

    @Schema(description = "수취인의 상대 체인 주소 (hex, 선택)", example = "0x2222222222222222222222222222222222222222")
    private String receiverCrossAddress;
}
