package dustin.escrow.domains.address.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.escrow.domains.address.model.dto.AddressResponse;
import dustin.escrow.domains.address.model.dto.MapAddressRequest;
import dustin.escrow.domains.address.service.AddressMappingService;
import dustin.escrow.domains.auth.middleware.CallerAuthenticationFilter;
import dustin.escrow.shared.ledger.LedgerCall;
import dustin.escrow.shared.ledger.LedgerClock;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 상대 체인 주소 컨트롤러
 * Address Mapping Controller
 *
 * API 엔드포인트:
 * - PUT /api/escrow/addresses - 내 상대 체인 주소 등록/교체
 * - GET /api/escrow/addresses/{account} - 계정의 상대 체인 주소 조회
 */
@RestController
@RequestMapping("/api/escrow/addresses")
@RequiredArgsConstructor
@Tag(name = "Addresses", description = "상대 체인 주소 API")
public class AddressMappingController {

    private final AddressMappingService addressMappingService;
    private final LedgerClock ledgerClock;

    @Operation(summary = "상대 체인 주소 등록", security = @SecurityRequirement(name = "BearerAuth"))
    @PutMapping
    public ResponseEntity<AddressResponse> mapAddress(
            @Valid @RequestBody MapAddressRequest request,
            HttpServletRequest httpRequest
    ) {
        String caller = (String) httpRequest.getAttribute(CallerAuthenticationFilter.CALLER_ATTRIBUTE);
        if (caller == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(addressMappingService.mapAddress(
                LedgerCall.of(caller, ledgerClock), request.getAddressType(), request.getAddress()));
    }

    @Operation(summary = "상대 체인 주소 조회")
    @GetMapping("/{account}")
    public ResponseEntity<AddressResponse> getAddress(@PathVariable String account) {
        return ResponseEntity.ok(addressMappingService.getAddress(account));
    }
}
