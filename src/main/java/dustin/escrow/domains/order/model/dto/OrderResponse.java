package dustin.escrow.domains.order.model.dto;

import java.time.LocalDateTime;
import java.util.List;

import dustin.escrow.domains.order.model.entity.SwapOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 응답 DTO
 * Order Response DTO
 *
 * 금액은 u128 정밀도 보존을 위해 10진 문자열로 반환합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "주문 응답")
public class OrderResponse {

    @Schema(description = "주문 정보")
    private OrderDto order;

    @Schema(description = "응답 메시지", example = "Order created")
    private String message;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "주문 상세")
    public static class OrderDto {
        private String orderId;
        private String maker;
        private String totalAmount;
        private String filledAmount;
        private String refundedAmount;
        /**
         * 체결 가능 잔량 (취소/완료 시 0)
         */
        private String remainingAmount;
        private String minFillAmount;
        private String hashlock;
        private Long timelock;
        private boolean cancelled;
        private boolean completed;
        private String swapId;
        private Long sourceChain;
        private Long destChain;
        private String destAmountPerUnit;
        private String fee;
        private boolean allowPartialFills;
        private Integer maxFills;
        private Integer currentFills;
        private String senderCrossAddress;
        private String receiverCrossAddress;
        private Long createdBlock;
        private List<String> fillIds;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;

        public static OrderDto from(SwapOrder order, String remainingAmount, List<String> fillIds) {
            return OrderDto.builder()
                    .orderId(order.getOrderId())
                    .maker(order.getMaker())
                    .totalAmount(order.getTotalAmount().toString())
                    .filledAmount(order.getFilledAmount().toString())
                    .refundedAmount(order.getRefundedAmount().toString())
                    .remainingAmount(remainingAmount)
                    .minFillAmount(order.getMinFillAmount().toString())
                    .hashlock(order.getHashlock())
                    .timelock(order.getTimelock())
                    .cancelled(Boolean.TRUE.equals(order.getCancelled()))
                    .completed(order.isCompleted())
                    .swapId(order.getSwapId())
                    .sourceChain(order.getSourceChain())
                    .destChain(order.getDestChain())
                    .destAmountPerUnit(order.getDestAmountPerUnit().toString())
                    .fee(order.getFee().toString())
                    .allowPartialFills(Boolean.TRUE.equals(order.getAllowPartialFills()))
                    .maxFills(order.getMaxFills())
                    .currentFills(order.getCurrentFills())
                    .senderCrossAddress(order.getSenderCrossAddress())
                    .receiverCrossAddress(order.getReceiverCrossAddress())
                    .createdBlock(order.getCreatedBlock())
                    .fillIds(fillIds)
                    .createdAt(order.getCreatedAt())
                    .updatedAt(order.getUpdatedAt())
                    .build();
        }
    }
}
