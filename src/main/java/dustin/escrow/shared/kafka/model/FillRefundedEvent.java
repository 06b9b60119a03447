package dustin.escrow.shared.kafka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 환불 이벤트
 * Fill Refunded Event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillRefundedEvent implements EscrowEvent {

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("fill_id")
    private String fillId;

    @JsonProperty("maker")
    private String maker;

    @JsonProperty("amount")
    private String amount;

    @JsonProperty("block_number")
    private long blockNumber;

    @Override
    public String eventName() {
        return "fill-refunded";
    }

    @Override
    public String eventKey() {
        return orderId;
    }
}
