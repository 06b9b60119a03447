package dustin.escrow.domains.fill.model.entity;

import java.math.BigInteger;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 엔티티
 * Fill Entity
 *
 * 역할:
 * - 한 taker가 주문의 일부(또는 전부)를 점유한 기록
 * - 출금(withdrawn) 또는 환불(refunded) 중 하나로만 종료
 *
 * 주문과의 관계는 orderId 조회 키로만 연결합니다 (연관관계 매핑 없음).
 * 주문별 체결 목록은 sequence(체결 카운터) 오름차순입니다.
 */
@Entity
@Table(name = "fills",
       indexes = {
           @Index(name = "idx_fills_order_sequence", columnList = "order_id,fill_sequence"),
           @Index(name = "idx_fills_open", columnList = "withdrawn,refunded")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Fill {

    @Id
    @Column(name = "fill_id", length = 64)
    private String fillId;

    @Column(name = "order_id", nullable = false, length = 64)
    private String orderId;

    @Column(name = "taker", nullable = false, length = 255)
    private String taker;

    /**
     * 체결 요청 시 전달된 수취인 (정보용, 출금은 taker에게 지급)
     */
    @Column(name = "receiver", length = 255)
    private String receiver;

    @Column(name = "fill_amount", nullable = false, precision = 39, scale = 0)
    private BigInteger fillAmount;

    /**
     * 목적 체인 금액 = fillAmount * destAmountPerUnit / 1e12
     */
    @Column(name = "dest_amount", nullable = false, precision = 39, scale = 0)
    private BigInteger destAmount;

    @Column(name = "escrow_id", nullable = false, length = 64)
    private String escrowId;

    @Column(name = "withdrawn", nullable = false)
    private Boolean withdrawn;

    @Column(name = "refunded", nullable = false)
    private Boolean refunded;

    /**
     * 공개된 32바이트 secret (출금 시에만 설정, hex)
     */
    @Column(name = "preimage", length = 64)
    private String preimage;

    @Column(name = "fill_sequence", nullable = false)
    private Long sequence;

    @Column(name = "ledger_timestamp", nullable = false)
    private Long ledgerTimestamp;

    @Column(name = "created_block", nullable = false)
    private Long createdBlock;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isOpen() {
        return !Boolean.TRUE.equals(withdrawn) && !Boolean.TRUE.equals(refunded);
    }

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
