package dustin.escrow.domains.fill.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.escrow.domains.fill.model.entity.Fill;

/**
 * 체결 리포지토리
 * Fill Repository
 */
@Repository
public interface FillRepository extends JpaRepository<Fill, String> {

    /**
     * 주문의 체결 목록 (생성 순서)
     */
    List<Fill> findByOrderIdOrderBySequenceAsc(String orderId);

    /**
     * 아직 종료되지 않은 체결 (대사용)
     */
    List<Fill> findByWithdrawnFalseAndRefundedFalse();
}
