package dustin.escrow.shared.kafka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수수료 출금 이벤트
 * Fees Swept Event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeesSweptEvent implements EscrowEvent {

    @JsonProperty("admin")
    private String admin;

    @JsonProperty("amount")
    private String amount;

    @JsonProperty("block_number")
    private long blockNumber;

    @Override
    public String eventName() {
        return "fees-swept";
    }

    @Override
    public String eventKey() {
        return admin;
    }
}
