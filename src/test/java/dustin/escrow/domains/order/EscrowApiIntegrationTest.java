package dustin.escrow.domains.order;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.escrow.config.TestConfig;
import dustin.escrow.config.TestLedgerClock;
import dustin.escrow.domains.auth.service.JwtService;
import dustin.escrow.domains.fee.repository.ProtocolStateRepository;
import dustin.escrow.domains.fill.repository.FillRepository;
import dustin.escrow.domains.ledger.repository.LedgerAccountRepository;
import dustin.escrow.domains.ledger.service.LedgerAccountService;
import dustin.escrow.domains.order.model.dto.CreateOrderRequest;
import dustin.escrow.domains.order.repository.SwapOrderRepository;
import dustin.escrow.shared.crypto.Hashes;
import dustin.escrow.shared.ledger.LedgerCall;

/**
 * 에스크로 API 통합 테스트
 * Escrow API Integration Test
 *
 * 테스트 항목:
 * 1. 인증 (Bearer 토큰 필수, 조회는 공개)
 * 2. 주문 생성 -> 체결 -> 출금 -> secret 조회 흐름
 * 3. 오류 응답 (kind, code, HTTP 상태)
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestConfig.class)
class EscrowApiIntegrationTest {

    private static final byte[] SECRET = Hashes.sha256("api-secret".getBytes(StandardCharsets.UTF_8));

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtService jwtService;

    @Autowired
    private TestLedgerClock testLedgerClock;

    @Autowired
    private LedgerAccountService ledgerAccountService;

    @Autowired
    private SwapOrderRepository swapOrderRepository;

    @Autowired
    private FillRepository fillRepository;

    @Autowired
    private LedgerAccountRepository ledgerAccountRepository;

    @Autowired
    private ProtocolStateRepository protocolStateRepository;

    @BeforeEach
    void setUp() {
        fillRepository.deleteAll();
        swapOrderRepository.deleteAll();
        ledgerAccountRepository.deleteAll();
        protocolStateRepository.deleteAll();
        testLedgerClock.setBlock(TestConfig.START_BLOCK);

        ledgerAccountService.credit(LedgerCall.of("admin", testLedgerClock), "alice", BigInteger.valueOf(100_000));
    }

    private String bearer(String account) {
        return "Bearer " + jwtService.issueCallerToken(account);
    }

    private CreateOrderRequest orderRequest() {
        return CreateOrderRequest.builder()
                .amount(BigInteger.valueOf(1000))
                .minFillAmount(BigInteger.valueOf(100))
                .hashlock(Hashes.toHex(Hashes.sha256(SECRET)))
                .timelock(TestConfig.START_BLOCK + 500)
                .swapId("42".repeat(32))
                .sourceChain(1L)
                .destChain(2L)
                .destAmountPerUnit(new BigInteger("1000000000000"))
                .maxFills(3)
                .build();
    }

    private String createOrder() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/escrow/orders")
                        .header("Authorization", bearer("alice"))
                        .header("X-Attached-Value", "1000")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(orderRequest())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order.totalAmount").value("997"))
                .andExpect(jsonPath("$.order.maker").value("alice"))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("order").get("orderId").asText();
    }

    @Test
    @DisplayName("토큰 없이 변경 요청 시 401")
    void testUnauthorized() throws Exception {
        mockMvc.perform(post("/api/escrow/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(orderRequest())))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/escrow/orders")
                        .header("Authorization", "Bearer not-a-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(orderRequest())))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("주문 생성 -> 체결 -> 출금 -> secret 조회")
    void testSwapFlow() throws Exception {
        // given
        String orderId = createOrder();

        // when: bob이 300 체결
        MvcResult fillResult = mockMvc.perform(post("/api/escrow/fills")
                        .header("Authorization", bearer("bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("orderId", orderId, "amount", 300))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.fillAmount").value("300"))
                .andExpect(jsonPath("$.destAmount").value("300"))
                .andReturn();
        String fillId = objectMapper.readTree(fillResult.getResponse().getContentAsString()).get("fillId").asText();

        mockMvc.perform(get("/api/escrow/fills/" + fillId + "/secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.preimage").value(nullValue()));

        // then: 출금
        mockMvc.perform(post("/api/escrow/fills/" + fillId + "/withdraw")
                        .header("Authorization", bearer("bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("preimage", Hashes.toHex(SECRET)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.withdrawn").value(true));

        mockMvc.perform(get("/api/escrow/fills/" + fillId + "/secret"))
                .andExpect(jsonPath("$.preimage").value(Hashes.toHex(SECRET)));
        mockMvc.perform(get("/api/escrow/orders/" + orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filledAmount").value("300"))
                .andExpect(jsonPath("$.remainingAmount").value("697"))
                .andExpect(jsonPath("$.fillIds", hasSize(1)));
        mockMvc.perform(get("/api/escrow/orders/" + orderId + "/remaining"))
                .andExpect(jsonPath("$.remainingAmount").value("697"));
        mockMvc.perform(get("/api/escrow/ledger/accounts/bob"))
                .andExpect(jsonPath("$.balance").value("300"));
    }

    @Test
    @DisplayName("오류 응답: 종류와 코드, HTTP 상태")
    void testErrorResponses() throws Exception {
        String orderId = createOrder();

        mockMvc.perform(get("/api/escrow/orders/" + "00".repeat(32)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));

        mockMvc.perform(post("/api/escrow/orders/" + orderId + "/cancel")
                        .header("Authorization", bearer("bob")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED_CANCEL"));

        // 만료 후 체결
        testLedgerClock.setBlock(TestConfig.START_BLOCK + 500);
        mockMvc.perform(post("/api/escrow/fills")
                        .header("Authorization", bearer("bob"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("orderId", orderId, "amount", 300))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("TIMING_VIOLATION"));

        mockMvc.perform(post("/api/escrow/orders/" + orderId + "/cancel")
                        .header("Authorization", bearer("alice")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.releasedAmount").value("997"));
    }

    @Test
    @DisplayName("요청 본문 검증 실패는 INVALID_PARAMETER")
    void testValidationError() throws Exception {
        CreateOrderRequest request = orderRequest();
        request.setHashlock(null);

        mockMvc.perform(post("/api/escrow/orders")
                        .header("Authorization", bearer("alice"))
                        .header("X-Attached-Value", "1000")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_PARAMETER"));
    }
}
