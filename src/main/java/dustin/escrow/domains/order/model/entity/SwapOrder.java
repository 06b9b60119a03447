package dustin.escrow.domains.order.model.entity;

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
 * 스왑 주문 엔티티
 * Swap Order Entity
 *
 * 역할:
 * - maker가 hashlock/timelock 아래 잠근 에스크로 주문
 * - 여러 taker의 부분 체결을 누적 관리
 *
 * 금액 관계:
 * - totalAmount: 수수료 차감 후 에스크로 순액 (생성 후 변경 없음)
 * - filledAmount: 환불되지 않은 체결 금액 합계
 * - refundedAmount: 체결 환불로 maker에게 돌아간 누적 금액
 * - filledAmount + refundedAmount <= totalAmount
 * - 체결 가능 잔량 = totalAmount - filledAmount - refundedAmount
 *
 * 데이터베이스 매핑:
 * - 테이블명: swap_orders
 * - ID: 64자리 hex (IdentifierGenerator.orderId)
 */
@Entity
@Table(name = "swap_orders",
       indexes = {
           @Index(name = "idx_swap_orders_maker", columnList = "maker"),
           @Index(name = "idx_swap_orders_cancelled", columnList = "cancelled")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapOrder {

    @Id
    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(name = "maker", nullable = false, length = 255)
    private String maker;

    @Column(name = "total_amount", nullable = false, precision = 39, scale = 0)
    private BigInteger totalAmount;

    @Column(name = "filled_amount", nullable = false, precision = 39, scale = 0)
    private BigInteger filledAmount;

    @Column(name = "refunded_amount", nullable = false, precision = 39, scale = 0)
    private BigInteger refundedAmount;

    @Column(name = "min_fill_amount", nullable = false, precision = 39, scale = 0)
    private BigInteger minFillAmount;

    /**
     * SHA-256(secret), 64자리 hex
     */
    @Column(name = "hashlock", nullable = false, length = 64)
    private String hashlock;

    /**
     * 만료 블록 높이 (절대값)
     */
    @Column(name = "timelock", nullable = false)
    private Long timelock;

    @Column(name = "cancelled", nullable = false)
    private Boolean cancelled;

    @Column(name = "swap_id", nullable = false, length = 64)
    private String swapId;

    @Column(name = "source_chain", nullable = false)
    private Long sourceChain;

    @Column(name = "dest_chain", nullable = false)
    private Long destChain;

    /**
     * 단위당 목적 체인 금액 (1e12 스케일)
     */
    @Column(name = "dest_amount_per_unit", nullable = false, precision = 39, scale = 0)
    private BigInteger destAmountPerUnit;

    /**
     * 생성 시 차감된 프로토콜 수수료
     */
    @Column(name = "fee", nullable = false, precision = 39, scale = 0)
    private BigInteger fee;

    @Column(name = "allow_partial_fills", nullable = false)
    private Boolean allowPartialFills;

    @Column(name = "max_fills", nullable = false)
    private Integer maxFills;

    @Column(name = "current_fills", nullable = false)
    private Integer currentFills;

    @Column(name = "sender_cross_address", length = 512)
    private String senderCrossAddress;

    @Column(name = "receiver_cross_address", length = 512)
    private String receiverCrossAddress;

    @Column(name = "created_block", nullable = false)
    private Long createdBlock;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 아직 어느 체결에도 할당되지 않은 금액
     * Amount never assigned to a fill (or returned by refund)
     */
    public BigInteger unclaimedAmount() {
        return totalAmount.subtract(filledAmount).subtract(refundedAmount);
    }

    /**
     * 전량 체결 여부 (filledAmount >= totalAmount)
     */
    public boolean isCompleted() {
        return filledAmount.compareTo(totalAmount) >= 0;
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
