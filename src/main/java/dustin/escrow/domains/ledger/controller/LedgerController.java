package dustin.escrow.domains.ledger.controller;

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
import dustin.escrow.domains.ledger.model.dto.BalanceResponse;
import dustin.escrow.domains.ledger.model.dto.CreditAccountRequest;
import dustin.escrow.domains.ledger.model.dto.FreezeAccountRequest;
import dustin.escrow.domains.ledger.service.LedgerAccountService;
import dustin.escrow.shared.ledger.LedgerCall;
import dustin.escrow.shared.ledger.LedgerClock;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 원장 컨트롤러
 * Ledger Controller
 *
 * API 엔드포인트:
 * - GET /api/escrow/ledger/accounts/{accountId} - 잔고 조회
 * - POST /api/escrow/ledger/accounts/credit - 계정 충전 (admin)
 * - POST /api/escrow/ledger/accounts/freeze - 계정 동결/해제 (admin)
 */
@RestController
@RequestMapping("/api/escrow/ledger/accounts")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "원장 계정 API")
public class LedgerController {

    private final LedgerAccountService ledgerAccountService;
    private final LedgerClock ledgerClock;

    @Operation(summary = "잔고 조회", description = "계정이 없으면 잔고 0으로 반환합니다.")
    @GetMapping("/{accountId}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerAccountService.getBalance(accountId));
    }

    @Operation(summary = "계정 충전 (admin)", security = @SecurityRequirement(name = "BearerAuth"))
    @PostMapping("/credit")
    public ResponseEntity<BalanceResponse> credit(
            @Valid @RequestBody CreditAccountRequest request,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(ledgerAccountService.credit(
                LedgerCall.of(caller, ledgerClock), request.getAccountId(), request.getAmount()));
    }

    @Operation(summary = "계정 동결/해제 (admin)", security = @SecurityRequirement(name = "BearerAuth"))
    @PostMapping("/freeze")
    public ResponseEntity<BalanceResponse> setFrozen(
            @Valid @RequestBody FreezeAccountRequest request,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(ledgerAccountService.setFrozen(
                LedgerCall.of(caller, ledgerClock), request.getAccountId(), request.isFrozen()));
    }
}
