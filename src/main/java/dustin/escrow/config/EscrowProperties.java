package dustin.escrow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * 에스크로 설정
 * Escrow Configuration
 *
 * 역할:
 * - protocol state 최초 생성 시 사용하는 기본값 (admin, 수수료율, timelock 범위)
 * - 에스크로 금고 계정, 원장 시계, 이벤트, 인증, 대사(reconciliation) 설정
 *
 * 설정 방법:
 * - application.yml의 escrow.* 에서 설정
 * - 환경변수로 오버라이드 가능
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "escrow")
public class EscrowProperties {

    /**
     * 최초 admin 계정
     * Initial protocol admin identity
     */
    private String admin = "admin";

    /**
     * 최초 수수료율 (bps, 30 = 0.3%)
     */
    private int defaultFeeRateBps = 30;

    /**
     * 최소 timelock (블록 수)
     */
    private long minTimelock = 100L;

    /**
     * 최대 timelock (블록 수)
     */
    private long maxTimelock = 14400L;

    /**
     * 에스크로 금액을 보관하는 원장 계정
     * Ledger account that holds escrowed value
     */
    private String vaultAccount = "escrow-vault";

    private Ledger ledger = new Ledger();

    private Events events = new Events();

    private Auth auth = new Auth();

    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Ledger {
        /** 블록 생성 간격 (초) */
        private long blockTimeSeconds = 6L;
        /** 블록 0의 epoch 초 */
        private long genesisEpochSecond = 1_700_000_000L;
    }

    @Data
    public static class Events {
        /** false면 Kafka로 발행하지 않고 로그만 남김 */
        private boolean kafkaEnabled = true;
        private String topicPrefix = "escrow.";
    }

    @Data
    public static class Auth {
        private String jwtSecret = "escrow-swap-jwt-secret-key-change-me-2024";
        private long tokenTtlMinutes = 60L;
    }

    @Data
    public static class Reconciliation {
        private String cron = "0 */10 * * * ?";
    }
}
