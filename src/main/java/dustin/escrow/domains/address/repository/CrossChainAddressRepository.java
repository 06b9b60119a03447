package dustin.escrow.domains.address.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.escrow.domains.address.model.entity.CrossChainAddressMapping;

/**
 * 상대 체인 주소 리포지토리
 * Cross-chain Address Repository
 */
@Repository
public interface CrossChainAddressRepository extends JpaRepository<CrossChainAddressMapping, String> {
}
