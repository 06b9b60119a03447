package dustin.escrow.domains.fill.controller;

import java.util.HashMap;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.escrow.domains.auth.middleware.CallerAuthenticationFilter;
import dustin.escrow.domains.fill.model.dto.FillOrderRequest;
import dustin.escrow.domains.fill.model.dto.FillResponse;
import dustin.escrow.domains.fill.model.dto.WithdrawFillRequest;
import dustin.escrow.domains.settlement.service.EscrowQueryService;
import dustin.escrow.domains.settlement.service.SwapSettlementService;
import dustin.escrow.shared.ledger.LedgerCall;
import dustin.escrow.shared.ledger.LedgerClock;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 체결 컨트롤러
 * Fill Controller
 *
 * API 엔드포인트:
 * - POST /api/escrow/fills - 주문 체결 (호출자 = taker)
 * - GET /api/escrow/fills/{fillId} - 체결 조회
 * - GET /api/escrow/fills/{fillId}/secret - 공개된 secret 조회
 * - POST /api/escrow/fills/{fillId}/withdraw - secret 공개 출금 (taker)
 * - POST /api/escrow/fills/{fillId}/refund - timelock 만료 후 환불 (maker)
 */
@RestController
@RequestMapping("/api/escrow/fills")
@RequiredArgsConstructor
@Tag(name = "Fills", description = "체결 API (체결, 출금, 환불)")
public class FillController {

    private final SwapSettlementService swapSettlementService;
    private final EscrowQueryService escrowQueryService;
    private final LedgerClock ledgerClock;

    /**
     * 주문 체결
     * Fill Order
     *
     * 요청 금액이 잔량보다 크면 잔량으로 줄여 체결합니다.
     */
    @Operation(
            summary = "주문 체결",
            description = "주문의 일부(또는 전부)를 호출자 몫으로 점유합니다. " +
                         "금액 이동은 출금 시에 일어납니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "체결 성공",
                    content = @Content(schema = @Schema(implementation = FillResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "잘못된 체결 금액"),
            @ApiResponse(responseCode = "404", description = "주문 없음"),
            @ApiResponse(responseCode = "409", description = "취소/완료/만료/최대 체결 횟수 도달/부분 체결 불가")
    })
    @PostMapping
    public ResponseEntity<FillResponse> fillOrder(
            @Valid @RequestBody FillOrderRequest request,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        String fillId = swapSettlementService.fillOrder(
                LedgerCall.of(caller, ledgerClock), request.getOrderId(), request.getAmount(), request.getReceiver());
        return ResponseEntity.status(HttpStatus.CREATED).body(escrowQueryService.getFill(fillId));
    }

    @Operation(summary = "체결 조회")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "체결 없음")
    })
    @GetMapping("/{fillId}")
    public ResponseEntity<FillResponse> getFill(@PathVariable String fillId) {
        return ResponseEntity.ok(escrowQueryService.getFill(fillId));
    }

    @Operation(summary = "공개된 secret 조회", description = "출금되지 않은 체결은 preimage가 null입니다.")
    @GetMapping("/{fillId}/secret")
    public ResponseEntity<Map<String, String>> getSecret(@PathVariable String fillId) {
        Map<String, String> body = new HashMap<>();
        body.put("fillId", fillId);
        body.put("preimage", escrowQueryService.getSecret(fillId).orElse(null));
        return ResponseEntity.ok(body);
    }

    /**
     * secret 공개 출금
     * Withdraw with secret
     */
    @Operation(
            summary = "출금 (secret 공개)",
            description = "taker가 timelock 만료 전에 sha256(preimage) == hashlock 인 secret을 공개하고 체결 금액을 받습니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "출금 성공"),
            @ApiResponse(responseCode = "403", description = "taker가 아님"),
            @ApiResponse(responseCode = "409", description = "이미 종료된 체결 또는 timelock 만료"),
            @ApiResponse(responseCode = "422", description = "secret 불일치"),
            @ApiResponse(responseCode = "502", description = "지급 실패")
    })
    @PostMapping("/{fillId}/withdraw")
    public ResponseEntity<FillResponse> withdraw(
            @PathVariable String fillId,
            @Valid @RequestBody WithdrawFillRequest request,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        swapSettlementService.withdraw(LedgerCall.of(caller, ledgerClock), fillId, request.getPreimage());
        return ResponseEntity.ok(escrowQueryService.getFill(fillId));
    }

    /**
     * timelock 만료 후 환불
     * Refund after expiry
     */
    @Operation(
            summary = "환불 (timelock 만료 후)",
            description = "maker가 timelock 만료 후 체결 금액을 돌려받습니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "환불 성공"),
            @ApiResponse(responseCode = "403", description = "maker가 아님"),
            @ApiResponse(responseCode = "409", description = "이미 종료된 체결 또는 timelock 미만료"),
            @ApiResponse(responseCode = "502", description = "지급 실패")
    })
    @PostMapping("/{fillId}/refund")
    public ResponseEntity<FillResponse> refund(
            @PathVariable String fillId,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        swapSettlementService.refund(LedgerCall.of(caller, ledgerClock), fillId);
        return ResponseEntity.ok(escrowQueryService.getFill(fillId));
    }
}
