package dustin.escrow.domains.settlement.service;

import java.math.BigInteger;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.escrow.domains.fee.model.entity.ProtocolState;
import dustin.escrow.domains.fee.service.FeeCalculator;
import dustin.escrow.domains.fee.service.FeeSplit;
import dustin.escrow.domains.fee.service.ProtocolStateService;
import dustin.escrow.domains.fill.model.entity.Fill;
import dustin.escrow.domains.fill.repository.FillRepository;
import dustin.escrow.domains.order.model.dto.CreateOrderRequest;
import dustin.escrow.domains.order.model.entity.SwapOrder;
import dustin.escrow.domains.order.repository.SwapOrderRepository;
import dustin.escrow.shared.crypto.Hashes;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;
import dustin.escrow.shared.id.IdentifierGenerator;
import dustin.escrow.shared.kafka.model.FillRefundedEvent;
import dustin.escrow.shared.kafka.model.FillWithdrawnEvent;
import dustin.escrow.shared.kafka.model.OrderCancelledEvent;
import dustin.escrow.shared.kafka.model.OrderCreatedEvent;
import dustin.escrow.shared.kafka.model.OrderFilledEvent;
import dustin.escrow.shared.ledger.EscrowLedger;
import dustin.escrow.shared.ledger.LedgerCall;
import dustin.escrow.shared.math.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 스왑 정산 서비스
 * Swap Settlement Service
 *
 * 역할:
 * - 주문 생성, 체결, 출금(secret 공개), 환불(timelock 만료), 주문 취소
 *
 * 처리 순서 (모든 작업 공통):
 * ==========================
 * 1. 프로토콜 상태 행에 비관적 락 (작업 직렬화)
 * 2. 모든 값 계산 및 검증 (상태 변경 없음)
 * 3. 원장 이동 (실패 가능, 실패 시 TRANSFER_FAILED)
 * 4. 주문/체결/프로토콜 상태 저장
 * 5. 이벤트 발행 (커밋 이후 Kafka로 전달)
 * 어느 단계에서든 예외가 발생하면 트랜잭션 전체가 롤백됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SwapSettlementService {

    /**
     * 상대 체인 주소 최대 길이 (바이트)
     */
    private static final int MAX_CROSS_ADDRESS_BYTES = 256;

    private final ProtocolStateService protocolStateService;
    private final SwapOrderRepository swapOrderRepository;
    private final FillRepository fillRepository;
    private final SwapSettlementValidator validator;
    private final FeeCalculator feeCalculator;
    private final IdentifierGenerator identifierGenerator;
    private final EscrowLedger escrowLedger;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 주문 생성
     * Create Order
     *
     * 처리 과정:
     * 1. 입력 파싱 (금액 범위, hex)
     * 2. 첨부 금액, timelock, 체인 쌍 검증
     * 3. 수수료 계산 후 에스크로 순액으로 최소 체결 금액 검증
     * 4. 주문 카운터 증가, 주문 ID 생성 (중복 시 ORDER_ALREADY_EXISTS)
     * 5. maker 계정에서 금고로 입금 총액 이동
     * 6. 주문 저장, 누적 수수료 증가
     *
     * @param call 호출 컨텍스트 (caller = maker)
     * @param request 주문 생성 요청
     * @return 주문 ID (64자리 hex)
     */
    @Transactional
    public String createOrder(LedgerCall call, CreateOrderRequest request) {
        ProtocolState state = protocolStateService.lockForUpdate();
        String maker = call.getCaller();

        // ==================== 1. 입력 파싱 ====================
        BigInteger grossAmount = Amounts.requireAmount(request.getAmount(), "amount");
        BigInteger minFillAmount = Amounts.requireAmount(request.getMinFillAmount(), "minFillAmount");
        BigInteger destAmountPerUnit = Amounts.requireAmount(request.getDestAmountPerUnit(), "destAmountPerUnit");
        byte[] hashlock = Hashes.parseHash(request.getHashlock(), "hashlock");
        byte[] swapId = Hashes.parseHash(request.getSwapId(), "swapId");
        String senderCrossAddress = normalizeCrossAddress(request.getSenderCrossAddress(), "senderCrossAddress");
        String receiverCrossAddress = normalizeCrossAddress(request.getReceiverCrossAddress(), "receiverCrossAddress");
        long timelock = request.getTimelock();
        int maxFills = request.getMaxFills();

        // ==================== 2. 검증 ====================
        validator.validateDeposit(call.getAttachedValue(), grossAmount);
        validator.validateTimelock(timelock, call.getBlockNumber(), state.getMinTimelock(), state.getMaxTimelock());
        validator.validateChainPair(request.getSourceChain(), request.getDestChain());

        // ==================== 3. 수수료 ====================
        FeeSplit split = feeCalculator.split(grossAmount, state.getFeeRateBps());
        validator.validateFillBounds(minFillAmount, split.getNet(), maxFills);
        BigInteger newAccumulatedFees = Amounts.checkedAdd(state.getAccumulatedFees(), split.getFee());

        // ==================== 4. 주문 ID ====================
        long orderCounter = Amounts.increment(state.getOrderCounter());
        String orderId = identifierGenerator.orderId(maker, split.getNet(), hashlock, timelock, swapId, orderCounter);
        if (swapOrderRepository.existsById(orderId)) {
            throw new EscrowException(EscrowErrorCode.ORDER_ALREADY_EXISTS, "order " + orderId + " already exists");
        }

        // ==================== 5. 입금 ====================
        escrowLedger.collectDeposit(maker, grossAmount);

        // ==================== 6. 저장 ====================
        SwapOrder order = SwapOrder.builder()
                .orderId(orderId)
                .maker(maker)
                .totalAmount(split.getNet())
                .filledAmount(BigInteger.ZERO)
                .refundedAmount(BigInteger.ZERO)
                .minFillAmount(minFillAmount)
                .hashlock(Hashes.toHex(hashlock))
                .timelock(timelock)
                .cancelled(false)
                .swapId(Hashes.toHex(swapId))
                .sourceChain(request.getSourceChain())
                .destChain(request.getDestChain())
                .destAmountPerUnit(destAmountPerUnit)
                .fee(split.getFee())
                .allowPartialFills(!Boolean.FALSE.equals(request.getAllowPartialFills()))
                .maxFills(maxFills)
                .currentFills(0)
                .senderCrossAddress(senderCrossAddress)
                .receiverCrossAddress(receiverCrossAddress)
                .createdBlock(call.getBlockNumber())
                .build();
        swapOrderRepository.save(order);

        state.setOrderCounter(orderCounter);
        state.setAccumulatedFees(newAccumulatedFees);

        log.info("[SwapSettlementService] 주문 생성: orderId={}, maker={}, total={}, fee={}, timelock={}",
                orderId, maker, split.getNet(), split.getFee(), timelock);

        eventPublisher.publishEvent(OrderCreatedEvent.builder()
                .orderId(orderId)
                .maker(maker)
                .totalAmount(split.getNet().toString())
                .fee(split.getFee().toString())
                .hashlock(order.getHashlock())
                .timelock(timelock)
                .swapId(order.getSwapId())
                .sourceChain(request.getSourceChain())
                .destChain(request.getDestChain())
                .blockNumber(call.getBlockNumber())
                .build());
        return orderId;
    }

    /**
     * 주문 체결
     * Fill Order
     *
     * 요청 금액이 잔량보다 크면 잔량으로 줄여 체결합니다.
     * 체결은 금액을 이동하지 않고 taker 몫으로 점유만 합니다 (출금 시 지급).
     *
     * @param call 호출 컨텍스트 (caller = taker)
     * @param orderId 주문 ID
     * @param requestedAmount 요청 체결 금액
     * @param receiver 수취인 (정보용)
     * @return 체결 ID (64자리 hex)
     */
    @Transactional
    public String fillOrder(LedgerCall call, String orderId, BigInteger requestedAmount, String receiver) {
        ProtocolState state = protocolStateService.lockForUpdate();
        String taker = call.getCaller();

        SwapOrder order = findOrder(orderId);
        Amounts.requireAmount(requestedAmount, "amount");

        // ==================== 검증 및 계산 ====================
        validator.validateFillEligibility(order, requestedAmount, call.getBlockNumber());
        BigInteger fillAmount = validator.resolveFillAmount(order, requestedAmount);
        BigInteger destAmount = Amounts.scaleByRate(fillAmount, order.getDestAmountPerUnit());
        BigInteger newFilledAmount = Amounts.checkedAdd(order.getFilledAmount(), fillAmount);
        long fillCounter = Amounts.increment(state.getFillCounter());

        String fillId = identifierGenerator.fillId(orderId, taker, fillAmount, call.getTimestamp(), call.getBlockNumber());
        if (fillRepository.existsById(fillId)) {
            throw new EscrowException(EscrowErrorCode.FILL_ALREADY_EXISTS, "fill " + fillId + " already exists");
        }
        String escrowId = identifierGenerator.escrowId(orderId, fillId, call.getTimestamp(), fillCounter);

        // ==================== 저장 ====================
        Fill fill = Fill.builder()
                .fillId(fillId)
                .orderId(orderId)
                .taker(taker)
                .receiver(receiver != null && !receiver.isBlank() ? receiver : taker)
                .fillAmount(fillAmount)
                .destAmount(destAmount)
                .escrowId(escrowId)
                .withdrawn(false)
                .refunded(false)
                .sequence(fillCounter)
                .ledgerTimestamp(call.getTimestamp())
                .createdBlock(call.getBlockNumber())
                .build();
        fillRepository.save(fill);

        order.setFilledAmount(newFilledAmount);
        order.setCurrentFills(order.getCurrentFills() + 1);
        swapOrderRepository.save(order);

        state.setFillCounter(fillCounter);

        log.info("[SwapSettlementService] 주문 체결: orderId={}, fillId={}, taker={}, amount={}, remaining={}",
                orderId, fillId, taker, fillAmount, order.unclaimedAmount());

        eventPublisher.publishEvent(OrderFilledEvent.builder()
                .orderId(orderId)
                .fillId(fillId)
                .taker(taker)
                .receiver(fill.getReceiver())
                .fillAmount(fillAmount.toString())
                .destAmount(destAmount.toString())
                .escrowId(escrowId)
                .remainingAmount(order.unclaimedAmount().toString())
                .blockNumber(call.getBlockNumber())
                .build());
        return fillId;
    }

    /**
     * 출금 (secret 공개)
     * Withdraw with secret reveal
     *
     * taker만, timelock 만료 전에, sha256(preimage) == hashlock 일 때 체결 금액을 taker에게 지급합니다.
     * secret은 32바이트 고정 길이입니다 (다르면 MALFORMED_HEX).
     *
     * @param call 호출 컨텍스트 (caller = taker)
     * @param fillId 체결 ID
     * @param preimageHex 32바이트 secret (hex)
     */
    @Transactional
    public void withdraw(LedgerCall call, String fillId, String preimageHex) {
        protocolStateService.lockForUpdate();

        Fill fill = findFill(fillId);
        SwapOrder order = findOrder(fill.getOrderId());

        validator.validateWithdrawal(fill, order, call.getCaller(), call.getBlockNumber());
        byte[] preimage = Hashes.parseHash(preimageHex, "preimage");
        validator.validateSecret(preimage, order.getHashlock());

        escrowLedger.release(fill.getTaker(), fill.getFillAmount());

        fill.setWithdrawn(true);
        fill.setPreimage(Hashes.toHex(preimage));
        fillRepository.save(fill);

        log.info("[SwapSettlementService] 출금 완료: fillId={}, taker={}, amount={}",
                fillId, fill.getTaker(), fill.getFillAmount());

        eventPublisher.publishEvent(FillWithdrawnEvent.builder()
                .orderId(order.getOrderId())
                .fillId(fillId)
                .taker(fill.getTaker())
                .amount(fill.getFillAmount().toString())
                .preimage(fill.getPreimage())
                .blockNumber(call.getBlockNumber())
                .build());
    }

    /**
     * 환불 (timelock 만료 후)
     * Refund after timelock expiry
     *
     * maker만, timelock 만료 후에 체결 금액을 maker에게 돌려줍니다.
     * 주문의 체결 금액/횟수는 줄고 환불 누적액은 늘어납니다.
     *
     * @param call 호출 컨텍스트 (caller = maker)
     * @param fillId 체결 ID
     */
    @Transactional
    public void refund(LedgerCall call, String fillId) {
        protocolStateService.lockForUpdate();

        Fill fill = findFill(fillId);
        SwapOrder order = findOrder(fill.getOrderId());

        validator.validateRefund(fill, order, call.getCaller(), call.getBlockNumber());
        BigInteger newFilledAmount = Amounts.checkedSub(order.getFilledAmount(), fill.getFillAmount());
        BigInteger newRefundedAmount = Amounts.checkedAdd(order.getRefundedAmount(), fill.getFillAmount());

        escrowLedger.release(order.getMaker(), fill.getFillAmount());

        fill.setRefunded(true);
        fillRepository.save(fill);

        order.setFilledAmount(newFilledAmount);
        order.setRefundedAmount(newRefundedAmount);
        order.setCurrentFills(order.getCurrentFills() - 1);
        swapOrderRepository.save(order);

        log.info("[SwapSettlementService] 환불 완료: fillId={}, maker={}, amount={}",
                fillId, order.getMaker(), fill.getFillAmount());

        eventPublisher.publishEvent(FillRefundedEvent.builder()
                .orderId(order.getOrderId())
                .fillId(fillId)
                .maker(order.getMaker())
                .amount(fill.getFillAmount().toString())
                .blockNumber(call.getBlockNumber())
                .build());
    }

    /**
     * 주문 취소
     * Cancel Order
     *
     * 어느 체결에도 할당되지 않은 잔량(total - filled - refunded)을 maker에게 돌려줍니다.
     * 이미 생성된 체결은 각자 출금/환불 절차를 그대로 따릅니다.
     *
     * @param call 호출 컨텍스트 (caller = maker)
     * @param orderId 주문 ID
     * @return maker에게 반환된 금액
     */
    @Transactional
    public BigInteger cancelOrder(LedgerCall call, String orderId) {
        protocolStateService.lockForUpdate();

        SwapOrder order = findOrder(orderId);
        if (!order.getMaker().equals(call.getCaller())) {
            throw new EscrowException(EscrowErrorCode.UNAUTHORIZED_CANCEL);
        }
        if (Boolean.TRUE.equals(order.getCancelled())) {
            throw new EscrowException(EscrowErrorCode.ORDER_CANCELLED);
        }

        BigInteger released = order.unclaimedAmount();
        if (released.signum() > 0) {
            escrowLedger.release(order.getMaker(), released);
        }

        order.setCancelled(true);
        swapOrderRepository.save(order);

        log.info("[SwapSettlementService] 주문 취소: orderId={}, maker={}, released={}",
                orderId, order.getMaker(), released);

        eventPublisher.publishEvent(OrderCancelledEvent.builder()
                .orderId(orderId)
                .maker(order.getMaker())
                .releasedAmount(released.toString())
                .blockNumber(call.getBlockNumber())
                .build());
        return released;
    }

    private SwapOrder findOrder(String orderId) {
        return swapOrderRepository.findById(orderId)
                .orElseThrow(() -> new EscrowException(EscrowErrorCode.ORDER_NOT_FOUND, "order not found: " + orderId));
    }

    private Fill findFill(String fillId) {
        return fillRepository.findById(fillId)
                .orElseThrow(() -> new EscrowException(EscrowErrorCode.FILL_NOT_FOUND, "fill not found: " + fillId));
    }

    private String normalizeCrossAddress(String hex, String field) {
        if (hex == null || hex.isBlank()) {
            return null;
        }
        byte[] bytes = Hashes.parseHex(hex, field);
        if (bytes.length > MAX_CROSS_ADDRESS_BYTES) {
            throw new EscrowException(EscrowErrorCode.MALFORMED_HEX,
                    field + " must be at most " + MAX_CROSS_ADDRESS_BYTES + " bytes");
        }
        return Hashes.toHex(bytes);
    }
}
