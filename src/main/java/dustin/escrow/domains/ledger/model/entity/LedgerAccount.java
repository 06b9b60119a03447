package dustin.escrow.domains.ledger.model.entity;

import java.math.BigInteger;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 원장 계정 엔티티
 * Ledger Account Entity
 *
 * 역할:
 * - 계정별 네이티브 잔고 보관 (에스크로 금고 계정 포함)
 * - frozen 계정은 입출금 모두 거부 (수신 거부하는 수취인 모델)
 */
@Entity
@Table(name = "ledger_accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerAccount {

    @Id
    @Column(name = "account_id", length = 255)
    private String accountId;

    @Column(name = "balance", nullable = false, precision = 39, scale = 0)
    private BigInteger balance;

    @Column(name = "frozen", nullable = false)
    private Boolean frozen;

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
