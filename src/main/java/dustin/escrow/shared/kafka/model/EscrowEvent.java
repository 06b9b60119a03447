package dustin.escrow.shared.kafka.model;

/**
 * 에스크로 이벤트
 * Escrow Event
 *
 * 상태 변경마다 하나씩 발행되며, 커밋 이후 Kafka 토픽 escrow.&lt;eventName&gt; 으로 전달됩니다.
 */
public interface EscrowEvent {

    /**
     * 토픽 접미사 (예: order-created)
     */
    String eventName();

    /**
     * 파티션 키 (주문 ID 또는 계정)
     */
    String eventKey();
}
