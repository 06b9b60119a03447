package dustin.escrow.shared.ledger;

import java.math.BigInteger;

/**
 * 에스크로 원장
 * Escrow Ledger
 *
 * 계정과 에스크로 금고 사이의 네이티브 가치 이동입니다.
 * 실패하면 TRANSFER_FAILED 오류를 던지며 어느 쪽 잔고도 변경하지 않습니다.
 */
public interface EscrowLedger {

    /**
     * 계정에서 금고로 입금
     */
    void collectDeposit(String from, BigInteger amount);

    /**
     * 금고에서 계정으로 지급
     */
    void release(String to, BigInteger amount);

    /**
     * 계정 잔고 (없으면 0)
     */
    BigInteger balanceOf(String accountId);
}
