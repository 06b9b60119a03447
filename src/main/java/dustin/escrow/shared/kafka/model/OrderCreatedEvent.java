package dustin.escrow.shared.kafka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 이벤트
 * Order Created Event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCreatedEvent implements EscrowEvent {

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("maker")
    private String maker;

    /**
     * 에스크로 순액 (10진 문자열)
     */
    @JsonProperty("total_amount")
    private String totalAmount;

    @JsonProperty("fee")
    private String fee;

    @JsonProperty("hashlock")
    private String hashlock;

    @JsonProperty("timelock")
    private long timelock;

    @JsonProperty("swap_id")
    private String swapId;

    @JsonProperty("source_chain")
    private long sourceChain;

    @JsonProperty("dest_chain")
    private long destChain;

    @JsonProperty("block_number")
    private long blockNumber;

    @Override
    public String eventName() {
        return "order-created";
    }

    @Override
    public String eventKey() {
        return orderId;
    }
}
