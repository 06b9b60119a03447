package dustin.escrow.domains.fee.model.entity;

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
 * 프로토콜 상태 엔티티
 * Protocol State Entity
 *
 * 역할:
 * - admin, 수수료율, 누적 수수료, timelock 범위, 주문/체결 카운터를 보관하는 단일 행
 * - 모든 상태 변경 작업은 이 행에 비관적 락을 잡고 시작 (작업 직렬화)
 */
@Entity
@Table(name = "protocol_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProtocolState {

    public static final long SINGLETON_ID = 1L;

    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "admin", nullable = false, length = 255)
    private String admin;

    /**
     * 수수료율 (bps, 0 ~ 1000)
     */
    @Column(name = "fee_rate_bps", nullable = false)
    private Integer feeRateBps;

    /**
     * 출금되지 않은 누적 프로토콜 수수료
     */
    @Column(name = "accumulated_fees", nullable = false, precision = 39, scale = 0)
    private BigInteger accumulatedFees;

    @Column(name = "min_timelock", nullable = false)
    private Long minTimelock;

    @Column(name = "max_timelock", nullable = false)
    private Long maxTimelock;

    @Column(name = "order_counter", nullable = false)
    private Long orderCounter;

    @Column(name = "fill_counter", nullable = false)
    private Long fillCounter;

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
