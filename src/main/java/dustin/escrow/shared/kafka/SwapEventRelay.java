package dustin.escrow.shared.kafka;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.escrow.shared.kafka.model.EscrowEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 에스크로 이벤트 중계기
 * Swap Event Relay
 *
 * 서비스가 ApplicationEventPublisher로 발행한 EscrowEvent를
 * 트랜잭션 커밋 이후에만 JSON으로 직렬화하여 Kafka로 전달합니다.
 * 롤백된 작업의 이벤트는 전달되지 않습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SwapEventRelay {

    private final KafkaEventProducer kafkaEventProducer;
    private final ObjectMapper objectMapper;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEscrowEvent(EscrowEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            kafkaEventProducer.publish(event.eventName(), event.eventKey(), json);
            log.info("[SwapEventRelay] 이벤트 전달: event={}, key={}", event.eventName(), event.eventKey());
        } catch (JsonProcessingException e) {
            log.error("[SwapEventRelay] 이벤트 직렬화 실패: event={}, error={}", event.eventName(), e.getMessage());
        }
    }
}
