package dustin.escrow.shared.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;

import dustin.escrow.config.EscrowProperties;

/**
 * Kafka 이벤트 발행 테스트
 * Kafka Event Producer Test
 */
class KafkaEventProducerTest {

    @SuppressWarnings("unchecked")
    private final KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);

    @Test
    @DisplayName("발행 비활성화 시 Kafka를 호출하지 않음")
    void testDisabled() {
        EscrowProperties properties = new EscrowProperties();
        properties.getEvents().setKafkaEnabled(false);
        KafkaEventProducer producer = new KafkaEventProducer(kafkaTemplate, properties, Runnable::run);

        boolean published = producer.publish("order-created", "key", "{}");

        assertThat(published).isFalse();
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("토픽은 접두사 + 이벤트 이름")
    void testTopicName() {
        EscrowProperties properties = new EscrowProperties();
        KafkaEventProducer producer = new KafkaEventProducer(kafkaTemplate, properties, Runnable::run);

        boolean published = producer.publish("order-created", "key", "{}");

        assertThat(published).isTrue();
        verify(kafkaTemplate).send("escrow.order-created", "key", "{}");
    }

    @Test
    @DisplayName("Kafka 전송 예외는 호출자에게 전파되지 않음")
    void testSendFailureSwallowedByPublisher() {
        EscrowProperties properties = new EscrowProperties();
        when(kafkaTemplate.send("escrow.fill-withdrawn", "key", "{}")).thenThrow(new IllegalStateException("broker down"));
        KafkaEventProducer producer = new KafkaEventProducer(kafkaTemplate, properties, Runnable::run);

        boolean published = producer.publish("fill-withdrawn", "key", "{}");

        assertThat(published).isTrue();
    }
}
