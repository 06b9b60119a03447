package dustin.escrow.domains.order.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.escrow.domains.order.model.entity.SwapOrder;

/**
 * 스왑 주문 리포지토리
 * Swap Order Repository
 */
@Repository
public interface SwapOrderRepository extends JpaRepository<SwapOrder, String> {

    /**
     * 취소되지 않은 주문 조회 (대사용)
     */
    List<SwapOrder> findByCancelledFalse();

    List<SwapOrder> findByMakerOrderByCreatedBlockDesc(String maker);
}
