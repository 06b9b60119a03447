package dustin.escrow.domains.ledger.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.escrow.domains.ledger.model.entity.LedgerAccount;
import jakarta.persistence.LockModeType;

/**
 * 원장 계정 리포지토리
 * Ledger Account Repository
 */
@Repository
public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, String> {

    /**
     * 계정 조회 (비관적 락)
     *
     * @param accountId 계정 ID
     * @return 계정 (없으면 Optional.empty())
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM LedgerAccount a WHERE a.accountId = :accountId")
    Optional<LedgerAccount> findByAccountIdForUpdate(@Param("accountId") String accountId);
}
