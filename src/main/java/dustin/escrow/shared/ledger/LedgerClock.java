package dustin.escrow.shared.ledger;

/**
 * 원장 시계
 * Ledger Clock
 *
 * 현재 블록 높이와 타임스탬프를 제공합니다. 블록 높이는 단조 증가해야 합니다.
 */
public interface LedgerClock {

    long currentBlock();

    long currentTimestamp();
}
