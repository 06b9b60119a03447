package dustin.escrow.domains.order.controller;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.escrow.domains.auth.middleware.CallerAuthenticationFilter;
import dustin.escrow.domains.order.model.dto.CreateOrderRequest;
import dustin.escrow.domains.order.model.dto.OrderResponse;
import dustin.escrow.domains.settlement.service.EscrowQueryService;
import dustin.escrow.domains.settlement.service.SwapSettlementService;
import dustin.escrow.shared.ledger.LedgerCall;
import dustin.escrow.shared.ledger.LedgerClock;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 주문 컨트롤러
 * Order Controller
 *
 * 역할:
 * - 스왑 주문 생성, 조회, 취소 REST API
 *
 * 인증:
 * - POST 요청은 JWT 필요 (subject = 호출자)
 * - 조회(GET)는 인증 없이 가능
 *
 * API 엔드포인트:
 * - POST /api/escrow/orders - 주문 생성 (X-Attached-Value 헤더로 첨부 금액 전달)
 * - GET /api/escrow/orders/{orderId} - 주문 조회
 * - GET /api/escrow/orders/{orderId}/fills - 체결 ID 목록
 * - GET /api/escrow/orders/{orderId}/exists - 존재 여부
 * - GET /api/escrow/orders/{orderId}/remaining - 체결 가능 잔량
 * - GET /api/escrow/orders/{orderId}/completed - 전량 체결 여부
 * - POST /api/escrow/orders/{orderId}/cancel - 주문 취소
 */
@RestController
@RequestMapping("/api/escrow/orders")
@RequiredArgsConstructor
@Tag(name = "Orders", description = "스왑 주문 API (생성, 조회, 취소)")
public class OrderController {

    private final SwapSettlementService swapSettlementService;
    private final EscrowQueryService escrowQueryService;
    private final LedgerClock ledgerClock;

    /**
     * 주문 생성
     * Create Order
     *
     * 응답:
     * - 201: 생성 성공
     * - 400: 잘못된 파라미터 (timelock 범위, 체인 쌍, 첨부 금액 부족 등)
     * - 401: 인증 실패
     * - 502: 입금 이동 실패
     */
    @Operation(
            summary = "주문 생성",
            description = "hashlock/timelock 아래 금액을 잠그는 주문을 생성합니다. " +
                         "X-Attached-Value 헤더의 금액이 amount 이상이어야 하며, " +
                         "amount에서 프로토콜 수수료를 뺀 금액이 에스크로됩니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "주문 생성 성공",
                    content = @Content(schema = @Schema(implementation = OrderResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "잘못된 요청"),
            @ApiResponse(responseCode = "401", description = "인증 실패"),
            @ApiResponse(responseCode = "502", description = "입금 이동 실패")
    })
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @Valid @RequestBody CreateOrderRequest request,
            @Parameter(description = "호출에 첨부한 금액")
            @RequestHeader(value = "X-Attached-Value", required = false) BigInteger attachedValue,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        LedgerCall call = LedgerCall.of(caller, ledgerClock, attachedValue);
        String orderId = swapSettlementService.createOrder(call, request);
        OrderResponse response = OrderResponse.builder()
                .order(escrowQueryService.getOrder(orderId))
                .message("Order created")
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "주문 조회", description = "주문 ID로 주문 상세와 체결 ID 목록을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "주문 없음")
    })
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse.OrderDto> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(escrowQueryService.getOrder(orderId));
    }

    @Operation(summary = "체결 ID 목록", description = "주문의 체결 ID를 생성 순서대로 반환합니다.")
    @GetMapping("/{orderId}/fills")
    public ResponseEntity<List<String>> getOrderFillIds(@PathVariable String orderId) {
        return ResponseEntity.ok(escrowQueryService.getOrderFillIds(orderId));
    }

    @Operation(summary = "주문 존재 여부")
    @GetMapping("/{orderId}/exists")
    public ResponseEntity<Map<String, Object>> orderExists(@PathVariable String orderId) {
        return ResponseEntity.ok(Map.of("orderId", orderId, "exists", escrowQueryService.orderExists(orderId)));
    }

    @Operation(summary = "체결 가능 잔량", description = "취소되었거나 전량 체결된 주문은 0입니다.")
    @GetMapping("/{orderId}/remaining")
    public ResponseEntity<Map<String, String>> getRemainingAmount(@PathVariable String orderId) {
        BigInteger remaining = escrowQueryService.getRemainingAmount(orderId);
        return ResponseEntity.ok(Map.of("orderId", orderId, "remainingAmount", remaining.toString()));
    }

    @Operation(summary = "전량 체결 여부")
    @GetMapping("/{orderId}/completed")
    public ResponseEntity<Map<String, Object>> isOrderCompleted(@PathVariable String orderId) {
        return ResponseEntity.ok(Map.of("orderId", orderId, "completed", escrowQueryService.isOrderCompleted(orderId)));
    }

    /**
     * 주문 취소
     * Cancel Order
     *
     * maker만 취소할 수 있으며, 미할당 잔량이 maker에게 반환됩니다.
     */
    @Operation(
            summary = "주문 취소",
            description = "주문을 취소하고 어느 체결에도 할당되지 않은 잔량을 maker에게 반환합니다. " +
                         "이미 생성된 체결은 각자 출금/환불 절차를 따릅니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "취소 성공"),
            @ApiResponse(responseCode = "403", description = "maker가 아님"),
            @ApiResponse(responseCode = "404", description = "주문 없음"),
            @ApiResponse(responseCode = "409", description = "이미 취소됨")
    })
    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<Map<String, String>> cancelOrder(
            @PathVariable String orderId,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        BigInteger released = swapSettlementService.cancelOrder(LedgerCall.of(caller, ledgerClock), orderId);
        return ResponseEntity.ok(Map.of("orderId", orderId, "releasedAmount", released.toString()));
    }
}
