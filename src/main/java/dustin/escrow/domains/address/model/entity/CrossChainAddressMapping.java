package dustin.escrow.domains.address.model.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상대 체인 주소 매핑 엔티티
 * Cross-chain Address Mapping Entity
 *
 * 계정당 하나의 상대 체인 주소를 보관합니다. 다시 등록하면 덮어씁니다.
 */
@Entity
@Table(name = "cross_chain_addresses")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrossChainAddressMapping {

    @Id
    @Column(name = "account", length = 255)
    private String account;

    @Enumerated(EnumType.STRING)
    @Column(name = "address_type", nullable = false, length = 20)
    private CrossChainAddressType addressType;

    /**
     * 주소 (소문자 hex, 0x 없음)
     */
    @Column(name = "address", nullable = false, length = 512)
    private String address;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
