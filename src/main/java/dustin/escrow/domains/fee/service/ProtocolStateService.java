package dustin.escrow.domains.fee.service;

import java.math.BigInteger;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.escrow.config.EscrowProperties;
import dustin.escrow.domains.fee.model.entity.ProtocolState;
import dustin.escrow.domains.fee.repository.ProtocolStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로토콜 상태 서비스
 * Protocol State Service
 *
 * 역할:
 * - 프로토콜 단일 행 조회 및 최초 생성 (escrow.* 설정값으로 초기화)
 * - 상태 변경 작업의 직렬화 지점 (lockForUpdate)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProtocolStateService {

    private final ProtocolStateRepository protocolStateRepository;
    private final EscrowProperties properties;

    /**
     * 프로토콜 상태를 비관적 락으로 조회
     * 행이 없으면 설정값으로 생성한 뒤 다시 락을 잡습니다.
     *
     * 호출자의 트랜잭션 안에서만 호출해야 합니다.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ProtocolState lockForUpdate() {
        return protocolStateRepository.findByIdForUpdate(ProtocolState.SINGLETON_ID)
                .orElseGet(() -> {
                    protocolStateRepository.saveAndFlush(initialState());
                    log.info("[ProtocolStateService] 프로토콜 상태 초기화: admin={}, feeRateBps={}",
                            properties.getAdmin(), properties.getDefaultFeeRateBps());
                    return protocolStateRepository.findByIdForUpdate(ProtocolState.SINGLETON_ID)
                            .orElseThrow(() -> new IllegalStateException("protocol state missing after init"));
                });
    }

    /**
     * 프로토콜 상태 조회 (락 없음, 없으면 기본값을 저장하지 않고 반환)
     */
    @Transactional(readOnly = true)
    public ProtocolState getState() {
        return protocolStateRepository.findById(ProtocolState.SINGLETON_ID)
                .orElseGet(this::initialState);
    }

    public String getAdmin() {
        return getState().getAdmin();
    }

    public int getFeeRateBps() {
        return getState().getFeeRateBps();
    }

    public BigInteger getAccumulatedFees() {
        return getState().getAccumulatedFees();
    }

    private ProtocolState initialState() {
        return ProtocolState.builder()
                .id(ProtocolState.SINGLETON_ID)
                .admin(properties.getAdmin())
                .feeRateBps(properties.getDefaultFeeRateBps())
                .accumulatedFees(BigInteger.ZERO)
                .minTimelock(properties.getMinTimelock())
                .maxTimelock(properties.getMaxTimelock())
                .orderCounter(0L)
                .fillCounter(0L)
                .build();
    }
}
