package dustin.escrow.domains.settlement.service;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.escrow.domains.fill.model.dto.FillResponse;
import dustin.escrow.domains.fill.model.entity.Fill;
import dustin.escrow.domains.fill.repository.FillRepository;
import dustin.escrow.domains.order.model.dto.OrderResponse;
import dustin.escrow.domains.order.model.entity.SwapOrder;
import dustin.escrow.domains.order.repository.SwapOrderRepository;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;
import lombok.RequiredArgsConstructor;

/**
 * 에스크로 조회 서비스
 * Escrow Query Service
 *
 * 주문/체결 읽기 전용 조회 (상태를 변경하지 않음)
 */
@Service
@RequiredArgsConstructor
public class EscrowQueryService {

    private final SwapOrderRepository swapOrderRepository;
    private final FillRepository fillRepository;

    @Transactional(readOnly = true)
    public OrderResponse.OrderDto getOrder(String orderId) {
        SwapOrder order = findOrder(orderId);
        return OrderResponse.OrderDto.from(order, remainingOf(order).toString(), fillIdsOf(orderId));
    }

    @Transactional(readOnly = true)
    public FillResponse getFill(String fillId) {
        return FillResponse.from(findFill(fillId));
    }

    /**
     * 주문의 체결 ID 목록 (생성 순서)
     */
    @Transactional(readOnly = true)
    public List<String> getOrderFillIds(String orderId) {
        findOrder(orderId);
        return fillIdsOf(orderId);
    }

    @Transactional(readOnly = true)
    public boolean orderExists(String orderId) {
        return swapOrderRepository.existsById(orderId);
    }

    /**
     * 체결 가능 잔량 (취소 또는 전량 체결이면 0)
     */
    @Transactional(readOnly = true)
    public BigInteger getRemainingAmount(String orderId) {
        return remainingOf(findOrder(orderId));
    }

    @Transactional(readOnly = true)
    public boolean isOrderCompleted(String orderId) {
        return findOrder(orderId).isCompleted();
    }

    /**
     * 공개된 secret 조회 (출금 전이면 empty)
     */
    @Transactional(readOnly = true)
    public Optional<String> getSecret(String fillId) {
        return Optional.ofNullable(findFill(fillId).getPreimage());
    }

    private BigInteger remainingOf(SwapOrder order) {
        if (Boolean.TRUE.equals(order.getCancelled()) || order.isCompleted()) {
            return BigInteger.ZERO;
        }
        return order.unclaimedAmount();
    }

    private List<String> fillIdsOf(String orderId) {
        return fillRepository.findByOrderIdOrderBySequenceAsc(orderId).stream()
                .map(Fill::getFillId)
                .collect(Collectors.toList());
    }

    private SwapOrder findOrder(String orderId) {
        return swapOrderRepository.findById(orderId)
                .orElseThrow(() -> new EscrowException(EscrowErrorCode.ORDER_NOT_FOUND, "order not found: " + orderId));
    }

    private Fill findFill(String fillId) {
        return fillRepository.findById(fillId)
                .orElseThrow(() -> new EscrowException(EscrowErrorCode.FILL_NOT_FOUND, "fill not found: " + fillId));
    }
}
