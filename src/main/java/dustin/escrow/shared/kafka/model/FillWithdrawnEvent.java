package dustin.escrow.shared.kafka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 출금 이벤트
 * Fill Withdrawn Event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillWithdrawnEvent implements EscrowEvent {

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("fill_id")
    private String fillId;

    @JsonProperty("taker")
    private String taker;

    @JsonProperty("amount")
    private String amount;

    /**
     * 공개된 secret (상대 체인에서 같은 hashlock을 푸는 데 사용)
     */
    @JsonProperty("preimage")
    private String preimage;

    @JsonProperty("block_number")
    private long blockNumber;

    @Override
    public String eventName() {
        return "fill-withdrawn";
    }

    @Override
    public String eventKey() {
        return orderId;
    }
}
