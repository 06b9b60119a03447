package dustin.escrow.domains.address.model.dto;

import dustin.escrow.domains.address.model.entity.CrossChainAddressMapping;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상대 체인 주소 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "상대 체인 주소")
public class AddressResponse {

    private String account;

    private String addressType;

    @Schema(description = "주소 (소문자 hex)")
    private String address;

    public static AddressResponse from(CrossChainAddressMapping mapping) {
        return AddressResponse.builder()
                .account(mapping.getAccount())
                .addressType(mapping.getAddressType().name())
                .address(mapping.getAddress())
                .build();
    }
}
