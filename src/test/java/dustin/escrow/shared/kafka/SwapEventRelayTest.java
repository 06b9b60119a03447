package dustin.escrow.shared.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.escrow.shared.kafka.model.FeesSweptEvent;
import dustin.escrow.shared.kafka.model.OrderFilledEvent;

/**
 * 이벤트 중계 테스트
 * Swap Event Relay Test
 */
class SwapEventRelayTest {

    private final KafkaEventProducer producer = mock(KafkaEventProducer.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SwapEventRelay relay = new SwapEventRelay(producer, objectMapper);

    @Test
    @DisplayName("체결 이벤트는 주문 ID를 키로, snake_case JSON으로 전달")
    void testOrderFilledEvent() throws Exception {
        // given
        OrderFilledEvent event = OrderFilledEvent.builder()
                .orderId("ab".repeat(32))
                .fillId("cd".repeat(32))
                .taker("bob")
                .receiver("bob")
                .fillAmount("200")
                .destAmount("400")
                .escrowId("ef".repeat(32))
                .remainingAmount("797")
                .blockNumber(1000L)
                .build();

        // when
        relay.onEscrowEvent(event);

        // then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(producer).publish(eq("order-filled"), eq("ab".repeat(32)), json.capture());

        JsonNode node = objectMapper.readTree(json.getValue());
        assertThat(node.get("fill_amount").asText()).isEqualTo("200");
        assertThat(node.get("dest_amount").asText()).isEqualTo("400");
        assertThat(node.get("block_number").asLong()).isEqualTo(1000L);
        assertThat(node.has("eventName")).isFalse();
    }

    @Test
    @DisplayName("수수료 인출 이벤트는 admin을 키로 전달")
    void testFeesSweptEvent() {
        FeesSweptEvent event = FeesSweptEvent.builder()
                .admin("admin")
                .amount("3")
                .blockNumber(1000L)
                .build();

        relay.onEscrowEvent(event);

        verify(producer).publish(eq("fees-swept"), eq("admin"), anyString());
    }
}
