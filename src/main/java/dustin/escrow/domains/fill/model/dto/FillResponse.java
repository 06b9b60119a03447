package dustin.escrow.domains.fill.model.dto;

import java.time.LocalDateTime;

import dustin.escrow.domains.fill.model.entity.Fill;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 응답 DTO
 * Fill Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "체결 정보")
public class FillResponse {

    private String fillId;
    private String orderId;
    private String taker;
    private String receiver;
    private String fillAmount;
    private String destAmount;
    private String escrowId;
    private boolean withdrawn;
    private boolean refunded;
    @Schema(description = "공개된 secret (출금 전에는 null)")
    private String preimage;
    private Long sequence;
    private Long ledgerTimestamp;
    private Long createdBlock;
    private LocalDateTime createdAt;

    public static FillResponse from(Fill fill) {
        return FillResponse.builder()
                .fillId(fill.getFillId())
                .orderId(fill.getOrderId())
                .taker(fill.getTaker())
                .receiver(fill.getReceiver())
                .fillAmount(fill.getFillAmount().toString())
                .destAmount(fill.getDestAmount().toString())
                .escrowId(fill.getEscrowId())
                .withdrawn(Boolean.TRUE.equals(fill.getWithdrawn()))
                .refunded(Boolean.TRUE.equals(fill.getRefunded()))
                .preimage(fill.getPreimage())
                .sequence(fill.getSequence())
                .ledgerTimestamp(fill.getLedgerTimestamp())
                .createdBlock(fill.getCreatedBlock())
                .createdAt(fill.getCreatedAt())
                .build();
    }
}
