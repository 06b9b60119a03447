package dustin.escrow.domains.fee;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

import java.math.BigInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;

import dustin.escrow.config.TestConfig;
import dustin.escrow.domains.fee.model.dto.ProtocolStateResponse;
import dustin.escrow.domains.fee.repository.ProtocolStateRepository;
import dustin.escrow.domains.fee.service.ProtocolAdminService;
import dustin.escrow.domains.fee.service.ProtocolStateService;
import dustin.escrow.domains.fill.repository.FillRepository;
import dustin.escrow.domains.ledger.repository.LedgerAccountRepository;
import dustin.escrow.domains.ledger.service.LedgerAccountService;
import dustin.escrow.domains.order.model.dto.CreateOrderRequest;
import dustin.escrow.domains.order.repository.SwapOrderRepository;
import dustin.escrow.domains.settlement.service.SwapSettlementService;
import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;
import dustin.escrow.shared.ledger.LedgerCall;

/**
 * 프로토콜 관리 테스트
 * Protocol Admin Service Test
 *
 * 테스트 항목:
 * 1. 수수료율 변경 (권한, 범위)
 * 2. admin 변경
 * 3. 누적 수수료 출금 및 지급 실패 시 복구 (원장 오류, DB 오류)
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
class ProtocolAdminServiceTest {

    private static final long NOW = 1_000L;

    @Autowired
    private ProtocolAdminService protocolAdminService;

    @Autowired
    private ProtocolStateService protocolStateService;

    @Autowired
    private SwapSettlementService swapSettlementService;

    @SpyBean
    private LedgerAccountService ledgerAccountService;

    @Autowired
    private ProtocolStateRepository protocolStateRepository;

    @Autowired
    private SwapOrderRepository swapOrderRepository;

    @Autowired
    private FillRepository fillRepository;

    @Autowired
    private LedgerAccountRepository ledgerAccountRepository;

    @BeforeEach
    void setUp() {
        fillRepository.deleteAll();
        swapOrderRepository.deleteAll();
        ledgerAccountRepository.deleteAll();
        protocolStateRepository.deleteAll();
    }

    private static LedgerCall call(String caller) {
        return LedgerCall.builder()
                .caller(caller)
                .blockNumber(NOW)
                .timestamp(1_700_000_000L + NOW * 6)
                .build();
    }

    private void createOrder(long amount) {
        ledgerAccountService.credit(call("admin"), "alice", BigInteger.valueOf(amount));
        LedgerCall deposit = LedgerCall.builder()
                .caller("alice")
                .blockNumber(NOW)
                .timestamp(1_700_000_000L + NOW * 6)
                .attachedValue(BigInteger.valueOf(amount))
                .build();
        swapSettlementService.createOrder(deposit, CreateOrderRequest.builder()
                .amount(BigInteger.valueOf(amount))
                .minFillAmount(BigInteger.ONE)
                .hashlock("aa".repeat(32))
                .timelock(NOW + 500)
                .swapId("bb".repeat(32))
                .sourceChain(1L)
                .destChain(2L)
                .destAmountPerUnit(BigInteger.ONE)
                .maxFills(1)
                .build());
    }

    @Test
    @DisplayName("최초 조회 시 설정값으로 초기화된 상태")
    void testInitialState() {
        ProtocolStateResponse state = protocolAdminService.getProtocolState();

        assertThat(state.getAdmin()).isEqualTo("admin");
        assertThat(state.getFeeRateBps()).isEqualTo(30);
        assertThat(state.getAccumulatedFees()).isEqualTo("0");
        assertThat(state.getMinTimelock()).isEqualTo(100L);
        assertThat(state.getMaxTimelock()).isEqualTo(14_400L);
    }

    @Test
    @DisplayName("수수료율 변경: admin만, 0 ~ 1000 bps")
    void testSetFeeRate() {
        assertThatThrownBy(() -> protocolAdminService.setFeeRate(call("alice"), 50))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.NOT_ADMIN);
        assertThatThrownBy(() -> protocolAdminService.setFeeRate(call("admin"), 1001))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.INVALID_FEE_RATE);

        protocolAdminService.setFeeRate(call("admin"), 1000);
        assertThat(protocolStateService.getFeeRateBps()).isEqualTo(1000);

        // 새 수수료율은 이후 주문부터 적용
        createOrder(1000);
        assertThat(protocolStateService.getAccumulatedFees()).isEqualTo(BigInteger.valueOf(100));
    }

    @Test
    @DisplayName("admin 변경 후 이전 admin은 권한 없음")
    void testUpdateAdmin() {
        protocolAdminService.updateAdmin(call("admin"), "treasury");

        assertThat(protocolStateService.getAdmin()).isEqualTo("treasury");
        assertThatThrownBy(() -> protocolAdminService.setFeeRate(call("admin"), 10))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.NOT_ADMIN);
        assertThatThrownBy(() -> protocolAdminService.updateAdmin(call("treasury"), " "))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.INVALID_ACCOUNT);
    }

    @Test
    @DisplayName("수수료 출금: admin에게 지급 후 누적 수수료 0")
    void testSweepFees() {
        // given
        createOrder(1000);

        // when
        BigInteger swept = protocolAdminService.sweepFees(call("admin"));

        // then
        assertThat(swept).isEqualTo(BigInteger.valueOf(3));
        assertThat(protocolStateService.getAccumulatedFees()).isZero();
        assertThat(ledgerAccountService.balanceOf("admin")).isEqualTo(BigInteger.valueOf(3));
        assertThat(ledgerAccountService.balanceOf("escrow-vault")).isEqualTo(BigInteger.valueOf(997));

        assertThatThrownBy(() -> protocolAdminService.sweepFees(call("admin")))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.NO_FEES_ACCRUED);
    }

    @Test
    @DisplayName("수수료 출금 지급 실패 시 누적 수수료 복구")
    void testSweepFeesRestoredOnTransferFailure() {
        // given
        createOrder(1000);
        ledgerAccountService.setFrozen(call("admin"), "admin", true);

        // when & then
        assertThatThrownBy(() -> protocolAdminService.sweepFees(call("admin")))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.TRANSFER_FAILED);

        assertThat(protocolStateService.getAccumulatedFees()).isEqualTo(BigInteger.valueOf(3));
        assertThat(ledgerAccountService.balanceOf("escrow-vault")).isEqualTo(BigInteger.valueOf(1000));
    }

    @Test
    @DisplayName("지급 중 DB 오류가 나도 누적 수수료 복구")
    void testSweepFeesRestoredOnDataAccessFailure() {
        // given
        createOrder(1000);
        doThrow(new DataAccessResourceFailureException("ledger unavailable"))
                .when(ledgerAccountService).release(eq("admin"), any());

        // when & then
        assertThatThrownBy(() -> protocolAdminService.sweepFees(call("admin")))
                .isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(protocolStateService.getAccumulatedFees()).isEqualTo(BigInteger.valueOf(3));
        assertThat(ledgerAccountService.balanceOf("escrow-vault")).isEqualTo(BigInteger.valueOf(1000));
        assertThat(ledgerAccountService.balanceOf("admin")).isZero();
    }

    @Test
    @DisplayName("admin이 아니면 수수료 출금 불가")
    void testSweepFeesNotAdmin() {
        createOrder(1000);

        assertThatThrownBy(() -> protocolAdminService.sweepFees(call("alice")))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.NOT_ADMIN);
        assertThat(protocolStateService.getAccumulatedFees()).isEqualTo(BigInteger.valueOf(3));
    }
}
