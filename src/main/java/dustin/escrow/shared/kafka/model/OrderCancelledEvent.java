package dustin.escrow.shared.kafka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 취소 이벤트
 * Order Cancelled Event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCancelledEvent implements EscrowEvent {

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("maker")
    private String maker;

    /**
     * maker에게 반환된 미체결 잔량
     */
    @JsonProperty("released_amount")
    private String releasedAmount;

    @JsonProperty("block_number")
    private long blockNumber;

    @Override
    public String eventName() {
        return "order-cancelled";
    }

    @Override
    public String eventKey() {
        return orderId;
    }
}
