package dustin.escrow.shared.kafka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 체결 이벤트
 * Order Filled Event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderFilledEvent implements EscrowEvent {

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("fill_id")
    private String fillId;

    @JsonProperty("taker")
    private String taker;

    @JsonProperty("receiver")
    private String receiver;

    @JsonProperty("fill_amount")
    private String fillAmount;

    /**
     * 목적 체인 환산 금액 (정보용)
     */
    @JsonProperty("dest_amount")
    private String destAmount;

    @JsonProperty("escrow_id")
    private String escrowId;

    @JsonProperty("remaining_amount")
    private String remainingAmount;

    @JsonProperty("block_number")
    private long blockNumber;

    @Override
    public String eventName() {
        return "order-filled";
    }

    @Override
    public String eventKey() {
        return orderId;
    }
}
