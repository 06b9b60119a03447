package dustin.escrow.domains.fee.controller;

import java.math.BigInteger;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.escrow.domains.auth.middleware.CallerAuthenticationFilter;
import dustin.escrow.domains.fee.model.dto.ProtocolStateResponse;
import dustin.escrow.domains.fee.model.dto.UpdateAdminRequest;
import dustin.escrow.domains.fee.model.dto.UpdateFeeRateRequest;
import dustin.escrow.domains.fee.service.ProtocolAdminService;
import dustin.escrow.domains.settlement.model.dto.ReconciliationResult;
import dustin.escrow.domains.settlement.service.EscrowReconciliationService;
import dustin.escrow.shared.ledger.LedgerCall;
import dustin.escrow.shared.ledger.LedgerClock;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 프로토콜 관리 컨트롤러
 * Protocol Admin Controller
 *
 * API 엔드포인트:
 * - GET /api/escrow/protocol - 프로토콜 상태 (admin, 수수료율, 누적 수수료, timelock 범위)
 * - PUT /api/escrow/protocol/fee-rate - 수수료율 변경 (admin)
 * - PUT /api/escrow/protocol/admin - admin 변경 (admin)
 * - POST /api/escrow/protocol/fees/sweep - 누적 수수료 출금 (admin)
 * - GET /api/escrow/protocol/reconciliation - 금고 대사 실행
 */
@RestController
@RequestMapping("/api/escrow/protocol")
@RequiredArgsConstructor
@Tag(name = "Protocol", description = "프로토콜 설정 및 수수료 API")
public class ProtocolAdminController {

    private final ProtocolAdminService protocolAdminService;
    private final EscrowReconciliationService escrowReconciliationService;
    private final LedgerClock ledgerClock;

    @Operation(summary = "프로토콜 상태 조회")
    @GetMapping
    public ResponseEntity<ProtocolStateResponse> getProtocolState() {
        return ResponseEntity.ok(protocolAdminService.getProtocolState());
    }

    @Operation(
            summary = "수수료율 변경",
            description = "admin만 호출할 수 있습니다. 0 ~ 1000 bps (0 ~ 10%).",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "400", description = "범위를 벗어난 수수료율"),
            @ApiResponse(responseCode = "403", description = "admin이 아님")
    })
    @PutMapping("/fee-rate")
    public ResponseEntity<ProtocolStateResponse> setFeeRate(
            @Valid @RequestBody UpdateFeeRateRequest request,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(protocolAdminService.setFeeRate(LedgerCall.of(caller, ledgerClock), request.getFeeRateBps()));
    }

    @Operation(summary = "admin 변경", security = @SecurityRequirement(name = "BearerAuth"))
    @PutMapping("/admin")
    public ResponseEntity<ProtocolStateResponse> updateAdmin(
            @Valid @RequestBody UpdateAdminRequest request,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(protocolAdminService.updateAdmin(LedgerCall.of(caller, ledgerClock), request.getNewAdmin()));
    }

    /**
     * 누적 수수료 출금
     * Sweep fees
     *
     * 지급에 실패하면 누적 수수료는 복구되고 502를 반환합니다.
     */
    @Operation(
            summary = "누적 수수료 출금",
            description = "누적된 프로토콜 수수료 전액을 admin에게 지급합니다. 지급 실패 시 누적 수수료는 복구됩니다.",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "출금 성공"),
            @ApiResponse(responseCode = "403", description = "admin이 아님"),
            @ApiResponse(responseCode = "409", description = "누적 수수료 없음"),
            @ApiResponse(responseCode = "502", description = "지급 실패 (누적 수수료 복구됨)")
    })
    @PostMapping("/fees/sweep")
    public ResponseEntity<Map<String, String>> sweepFees(HttpServletRequest httpRequest) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        BigInteger amount = protocolAdminService.sweepFees(LedgerCall.of(caller, ledgerClock));
        return ResponseEntity.ok(Map.of("admin", caller, "amount", amount.toString()));
    }

    @Operation(summary = "금고 대사", description = "금고 잔고와 미지급 의무 합계를 비교합니다.")
    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationResult> reconcile() {
        return ResponseEntity.ok(escrowReconciliationService.reconcile());
    }
}
