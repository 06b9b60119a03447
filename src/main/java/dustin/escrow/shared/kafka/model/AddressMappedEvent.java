package dustin.escrow.shared.kafka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상대 체인 주소 등록 이벤트
 * Address Mapped Event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddressMappedEvent implements EscrowEvent {

    @JsonProperty("account")
    private String account;

    @JsonProperty("address_type")
    private String addressType;

    @JsonProperty("address")
    private String address;

    @JsonProperty("block_number")
    private long blockNumber;

    @Override
    public String eventName() {
        return "address-mapped";
    }

    @Override
    public String eventKey() {
        return account;
    }
}
