package dustin.escrow.shared.ledger;

import java.time.Clock;

import org.springframework.stereotype.Component;

import dustin.escrow.config.EscrowProperties;
import lombok.RequiredArgsConstructor;

/**
 * 시스템 시계 기반 원장 시계
 * System Ledger Clock
 *
 * 블록 높이 = (현재 epoch 초 - genesis epoch 초) / 블록 시간
 */
@Component
@RequiredArgsConstructor
public class SystemLedgerClock implements LedgerClock {

    private final EscrowProperties properties;
    private final Clock clock = Clock.systemUTC();

    @Override
    public long currentBlock() {
        long elapsed = currentTimestamp() - properties.getLedger().getGenesisEpochSecond();
        if (elapsed <= 0) {
            return 0L;
        }
        return elapsed / Math.max(1L, properties.getLedger().getBlockTimeSeconds());
    }

    @Override
    public long currentTimestamp() {
        return clock.instant().getEpochSecond();
    }
}
