package dustin.escrow.domains.fee.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.escrow.domains.fee.model.entity.ProtocolState;
import jakarta.persistence.LockModeType;

/**
 * 프로토콜 상태 리포지토리
 * Protocol State Repository
 */
@Repository
public interface ProtocolStateRepository extends JpaRepository<ProtocolState, Long> {

    /**
     * 프로토콜 상태 조회 (비관적 락)
     * 트랜잭션이 끝날 때까지 다른 상태 변경 작업은 대기합니다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM ProtocolState p WHERE p.id = :id")
    Optional<ProtocolState> findByIdForUpdate(@Param("id") Long id);
}
