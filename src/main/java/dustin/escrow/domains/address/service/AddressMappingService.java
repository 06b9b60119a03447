package dustin.escrow.domains.address.service;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.escrow.domains.address.model.dto.AddressResponse;
import dustin.escrow.domains.address.model.entity.CrossChainAddressMapping;
import dustin.escrow.domains.address.model.entity.CrossChainAddressType;
import dustin.escrow.domains.address.repository.CrossChainAddressRepository;
import dustin.escrow.shared.crypto.Hashes;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;
import dustin.escrow.shared.kafka.model.AddressMappedEvent;
import dustin.escrow.shared.ledger.LedgerCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 상대 체인 주소 서비스
 * Address Mapping Service
 *
 * 역할:
 * - 호출자 계정의 상대 체인 주소 등록/교체
 * - 계정별 주소 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AddressMappingService {

    private final CrossChainAddressRepository crossChainAddressRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 상대 체인 주소 등록
     * Map cross-chain address for caller
     *
     * @param call 호출 컨텍스트 (caller = 등록 계정)
     * @param type 주소 유형
     * @param addressHex 주소 (hex)
     * @return 등록된 주소
     * @throws EscrowException MALFORMED_HEX - hex 형식 또는 길이 불일치
     */
    @Transactional
    public AddressResponse mapAddress(LedgerCall call, CrossChainAddressType type, String addressHex) {
        byte[] address = Hashes.parseHex(addressHex, "address");
        if (!type.accepts(address.length)) {
            throw new EscrowException(EscrowErrorCode.MALFORMED_HEX,
                    type + " address must be " + (type.getExpectedLength() > 0
                            ? type.getExpectedLength() + " bytes"
                            : "1-" + CrossChainAddressType.MAX_RAW_LENGTH + " bytes") + ", got " + address.length);
        }

        CrossChainAddressMapping mapping = crossChainAddressRepository.findById(call.getCaller())
                .orElseGet(() -> CrossChainAddressMapping.builder().account(call.getCaller()).build());
        mapping.setAddressType(type);
        mapping.setAddress(Hashes.toHex(address));
        crossChainAddressRepository.save(mapping);

        log.info("[AddressMappingService] 주소 등록: account={}, type={}", call.getCaller(), type);

        eventPublisher.publishEvent(AddressMappedEvent.builder()
                .account(call.getCaller())
                .addressType(type.name())
                .address(mapping.getAddress())
                .blockNumber(call.getBlockNumber())
                .build());
        return AddressResponse.from(mapping);
    }

    @Transactional(readOnly = true)
    public AddressResponse getAddress(String account) {
        return crossChainAddressRepository.findById(account)
                .map(AddressResponse::from)
                .orElseThrow(() -> new EscrowException(EscrowErrorCode.ADDRESS_NOT_FOUND,
                        "no cross-chain address for " + account));
    }
}
