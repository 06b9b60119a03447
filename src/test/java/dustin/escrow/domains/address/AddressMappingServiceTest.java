package dustin.escrow.domains.address;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import dustin.escrow.config.TestConfig;
import dustin.escrow.domains.address.model.dto.AddressResponse;
import dustin.escrow.domains.address.model.entity.CrossChainAddressType;
import dustin.escrow.domains.address.repository.CrossChainAddressRepository;
import dustin.escrow.domains.address.service.AddressMappingService;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;
import dustin.escrow.shared.ledger.LedgerCall;

/**
 * 상대 체인 주소 등록 테스트
 * Address Mapping Service Test
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
class AddressMappingServiceTest {

    @Autowired
    private AddressMappingService addressMappingService;

    @Autowired
    private CrossChainAddressRepository crossChainAddressRepository;

    @BeforeEach
    void setUp() {
        crossChainAddressRepository.deleteAll();
    }

    private static LedgerCall call(String caller) {
        return LedgerCall.builder().caller(caller).blockNumber(1_000L).timestamp(1_700_006_000L).build();
    }

    @Test
    @DisplayName("이더리움 주소 등록 후 조회, 재등록 시 교체")
    void testMapAndReplace() {
        // when
        addressMappingService.mapAddress(call("alice"), CrossChainAddressType.ETHEREUM, "0x" + "11".repeat(20));
        addressMappingService.mapAddress(call("alice"), CrossChainAddressType.SUBSTRATE, "22".repeat(32));

        // then
        AddressResponse response = addressMappingService.getAddress("alice");
        assertThat(response.getAddressType()).isEqualTo("SUBSTRATE");
        assertThat(response.getAddress()).isEqualTo("22".repeat(32));
        assertThat(crossChainAddressRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("유형별 길이가 맞지 않으면 MALFORMED_HEX")
    void testLengthMismatch() {
        assertThatThrownBy(() -> addressMappingService.mapAddress(call("alice"),
                CrossChainAddressType.ETHEREUM, "11".repeat(19)))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.MALFORMED_HEX);
        assertThatThrownBy(() -> addressMappingService.mapAddress(call("alice"), CrossChainAddressType.RAW, "0x"))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.MALFORMED_HEX);
        assertThatThrownBy(() -> addressMappingService.mapAddress(call("alice"),
                CrossChainAddressType.RAW, "ab".repeat(257)))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.MALFORMED_HEX);
        assertThatThrownBy(() -> addressMappingService.mapAddress(call("alice"), CrossChainAddressType.RAW, "zz"))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.MALFORMED_HEX);

        assertThat(crossChainAddressRepository.count()).isZero();
    }

    @Test
    @DisplayName("등록되지 않은 계정 조회는 ADDRESS_NOT_FOUND")
    void testNotFound() {
        assertThatThrownBy(() -> addressMappingService.getAddress("nobody"))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.ADDRESS_NOT_FOUND);
    }
}
