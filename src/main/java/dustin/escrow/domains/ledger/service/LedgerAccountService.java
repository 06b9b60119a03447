package dustin.escrow.domains.ledger.service;

import java.math.BigInteger;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.escrow.config.EscrowProperties;
import dustin.escrow.domains.fee.model.entity.ProtocolState;
import dustin.escrow.domains.fee.service.ProtocolStateService;
import dustin.escrow.domains.ledger.model.dto.BalanceResponse;
import dustin.escrow.domains.ledger.model.entity.LedgerAccount;
import dustin.escrow.domains.ledger.repository.LedgerAccountRepository;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;
import dustin.escrow.shared.ledger.EscrowLedger;
import dustin.escrow.shared.ledger.LedgerCall;
import dustin.escrow.shared.math.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 원장 계정 서비스
 * Ledger Account Service
 *
 * 역할:
 * - 계정 <-> 에스크로 금고 사이의 가치 이동 (EscrowLedger 구현)
 * - admin 전용 계정 충전(credit) 및 동결(freeze)
 * - 잔고 조회
 *
 * 이동 규칙:
 * ==========
 * 1. 두 계정을 ID 순서대로 비관적 락으로 조회 (교착 방지)
 * 2. 출금 계정 존재, 잔고 충분, 양쪽 모두 동결 아님을 먼저 확인
 * 3. 확인이 모두 끝난 뒤에만 양쪽 잔고를 변경
 * 입금 계정이 없으면 잔고 0으로 생성합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerAccountService implements EscrowLedger {

    private final LedgerAccountRepository ledgerAccountRepository;
    private final ProtocolStateService protocolStateService;
    private final EscrowProperties properties;

    @Override
    @Transactional
    public void collectDeposit(String from, BigInteger amount) {
        move(from, properties.getVaultAccount(), amount);
    }

    @Override
    @Transactional
    public void release(String to, BigInteger amount) {
        move(properties.getVaultAccount(), to, amount);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String accountId) {
        return ledgerAccountRepository.findById(accountId)
                .map(LedgerAccount::getBalance)
                .orElse(BigInteger.ZERO);
    }

    /**
     * 계정 잔고 조회
     * Get account balance
     *
     * @param accountId 계정 ID
     * @return 잔고 (계정이 없으면 잔고 0, 동결 아님)
     */
    @Transactional(readOnly = true)
    public BalanceResponse getBalance(String accountId) {
        Optional<LedgerAccount> account = ledgerAccountRepository.findById(accountId);
        return BalanceResponse.builder()
                .accountId(accountId)
                .balance(account.map(LedgerAccount::getBalance).orElse(BigInteger.ZERO).toString())
                .frozen(account.map(LedgerAccount::getFrozen).orElse(false))
                .build();
    }

    /**
     * 계정 충전 (admin 전용)
     * Credit account (admin only)
     *
     * 호스트의 네이티브 발행을 대신합니다. 금고 계정은 충전할 수 없습니다.
     */
    @Transactional
    public BalanceResponse credit(LedgerCall call, String accountId, BigInteger amount) {
        requireAdmin(call);
        requireUserAccount(accountId);
        Amounts.requireAmount(amount, "amount");

        LedgerAccount account = lockOrCreate(accountId);
        account.setBalance(Amounts.checkedAdd(account.getBalance(), amount));
        ledgerAccountRepository.save(account);

        log.info("[LedgerAccountService] 계정 충전: account={}, amount={}, balance={}",
                accountId, amount, account.getBalance());
        return getBalance(accountId);
    }

    /**
     * 계정 동결/해제 (admin 전용)
     * Freeze or unfreeze account (admin only)
     */
    @Transactional
    public BalanceResponse setFrozen(LedgerCall call, String accountId, boolean frozen) {
        requireAdmin(call);
        requireUserAccount(accountId);

        LedgerAccount account = lockOrCreate(accountId);
        account.setFrozen(frozen);
        ledgerAccountRepository.save(account);

        log.info("[LedgerAccountService] 계정 동결 상태 변경: account={}, frozen={}", accountId, frozen);
        return getBalance(accountId);
    }

    private void move(String from, String to, BigInteger amount) {
        Amounts.requireAmount(amount, "amount");

        // ID 순서대로 락 획득
        LedgerAccount source;
        LedgerAccount target;
        if (from.compareTo(to) <= 0) {
            source = ledgerAccountRepository.findByAccountIdForUpdate(from).orElse(null);
            target = ledgerAccountRepository.findByAccountIdForUpdate(to).orElse(null);
        } else {
            target = ledgerAccountRepository.findByAccountIdForUpdate(to).orElse(null);
            source = ledgerAccountRepository.findByAccountIdForUpdate(from).orElse(null);
        }

        // ==================== 검증 (변경 전) ====================
        if (source == null) {
            throw transferFailed(from, to, amount, "source account not found");
        }
        if (Boolean.TRUE.equals(source.getFrozen())) {
            throw transferFailed(from, to, amount, "source account frozen");
        }
        if (target != null && Boolean.TRUE.equals(target.getFrozen())) {
            throw transferFailed(from, to, amount, "target account frozen");
        }
        if (source.getBalance().compareTo(amount) < 0) {
            throw transferFailed(from, to, amount, "insufficient balance");
        }
        if (from.equals(to)) {
            return;
        }
        if (target == null) {
            target = newAccount(to);
        }
        BigInteger newTargetBalance = Amounts.checkedAdd(target.getBalance(), amount);

        // ==================== 변경 ====================
        source.setBalance(source.getBalance().subtract(amount));
        target.setBalance(newTargetBalance);
        ledgerAccountRepository.save(source);
        ledgerAccountRepository.save(target);

        log.debug("[LedgerAccountService] 이동 완료: {} -> {}, amount={}", from, to, amount);
    }

    private LedgerAccount lockOrCreate(String accountId) {
        return ledgerAccountRepository.findByAccountIdForUpdate(accountId)
                .orElseGet(() -> newAccount(accountId));
    }

    private LedgerAccount newAccount(String accountId) {
        return LedgerAccount.builder()
                .accountId(accountId)
                .balance(BigInteger.ZERO)
                .frozen(false)
                .build();
    }

    private void requireAdmin(LedgerCall call) {
        ProtocolState state = protocolStateService.lockForUpdate();
        if (!state.getAdmin().equals(call.getCaller())) {
            throw new EscrowException(EscrowErrorCode.NOT_ADMIN);
        }
    }

    private void requireUserAccount(String accountId) {
        if (accountId == null || accountId.isBlank() || accountId.equals(properties.getVaultAccount())) {
            throw new EscrowException(EscrowErrorCode.INVALID_ACCOUNT, "invalid account: " + accountId);
        }
    }

    private EscrowException transferFailed(String from, String to, BigInteger amount, String reason) {
        log.warn("[LedgerAccountService] 이동 거부: {} -> {}, amount={}, reason={}", from, to, amount, reason);
        return new EscrowException(EscrowErrorCode.TRANSFER_FAILED,
                "transfer " + from + " -> " + to + " rejected: " + reason);
    }
}
