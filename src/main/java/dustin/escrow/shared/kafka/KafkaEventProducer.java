package dustin.escrow.shared.kafka;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import dustin.escrow.config.EscrowProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 이벤트 발행자
 * Kafka Event Producer
 *
 * 역할:
 * - 에스크로 상태 변경 이벤트를 Kafka로 발행
 * - 비동기 처리 (논블로킹)
 *
 * 주의사항:
 * - 발행 실패는 로그만 남기고 호출자에게 전파하지 않음
 * - escrow.events.kafka-enabled=false면 발행하지 않음
 */
@Slf4j
@Component
public class KafkaEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final EscrowProperties properties;
    private final Executor executor;

    public KafkaEventProducer(KafkaTemplate<String, String> kafkaTemplate,
                              EscrowProperties properties,
                              @Qualifier("eventPublisherExecutor") Executor executor) {
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * 이벤트 발행
     * Publish event
     *
     * @param eventName 토픽 접미사 (예: order-created)
     * @param key 파티션 키
     * @param payloadJson 이벤트 JSON
     * @return 발행 요청 여부 (비활성화 상태면 false)
     */
    public boolean publish(String eventName, String key, String payloadJson) {
        if (!properties.getEvents().isKafkaEnabled()) {
            log.debug("[KafkaEventProducer] 발행 비활성화, 건너뜀: event={}, key={}", eventName, key);
            return false;
        }
        String topic = properties.getEvents().getTopicPrefix() + eventName;
        try {
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                try {
                    kafkaTemplate.send(topic, key, payloadJson);
                } catch (Exception e) {
                    log.error("[KafkaEventProducer] 이벤트 발행 실패: topic={}, key={}, error={}",
                            topic, key, e.getMessage());
                }
            }, executor);

            future.exceptionally(ex -> {
                log.error("[KafkaEventProducer] 이벤트 발행 중 예외 발생: topic={}, error={}", topic, ex.getMessage());
                return null;
            });
            return true;
        } catch (Exception e) {
            log.error("[KafkaEventProducer] 이벤트 발행 실패: topic={}, error={}", topic, e.getMessage());
            return false;
        }
    }
}
