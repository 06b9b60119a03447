package dustin.escrow.shared.id;

import java.math.BigInteger;

import org.springframework.stereotype.Component;

import dustin.escrow.shared.crypto.Hashes;

/**
 * 식별자 생성기
 * Identifier Generator
 *
 * 역할:
 * - 주문, 체결, 에스크로 레코드의 256비트 식별자를 정의 파라미터로부터 결정적으로 생성
 * - SHA-256 사용, 결과는 64자리 소문자 hex
 *
 * 카운터:
 * - 호출자가 protocol state의 카운터를 증가시킨 뒤 증가된 값을 전달
 * - 같은 파라미터로 두 번 생성해도 카운터가 다르므로 식별자가 다름
 */
@Component
public class IdentifierGenerator {

    /**
     * 주문 ID 생성
     * Order id = H(maker ‖ net_amount ‖ hashlock ‖ timelock ‖ swap_id ‖ order_counter)
     *
     * @param maker 주문 생성자
     * @param netAmount 수수료 차감 후 에스크로 금액
     * @param hashlock 32바이트 hashlock
     * @param timelock 만료 블록 높이
     * @param swapId 32바이트 swap id
     * @param orderCounter 증가 후 주문 카운터
     * @return 64자리 hex 주문 ID
     */
    public String orderId(String maker, BigInteger netAmount, byte[] hashlock, long timelock,
                          byte[] swapId, long orderCounter) {
        byte[] hash = new Hashes.Preimage()
                .identity(maker)
                .u128(netAmount)
                .bytes(hashlock)
                .u64(timelock)
                .bytes(swapId)
                .u64(orderCounter)
                .digest();
        return Hashes.toHex(hash);
    }

    /**
     * 체결 ID 생성
     * Fill id = H(order_id ‖ taker ‖ fill_amount ‖ timestamp ‖ height)
     *
     * 카운터를 쓰지 않으므로 같은 블록에서 같은 taker가 같은 수량을 두 번 체결하면 충돌합니다.
     * 충돌은 호출자가 FILL_ALREADY_EXISTS로 거부합니다.
     */
    public String fillId(String orderId, String taker, BigInteger fillAmount, long timestamp, long height) {
        byte[] hash = new Hashes.Preimage()
                .bytes(Hashes.parseHash(orderId, "orderId"))
                .identity(taker)
                .u128(fillAmount)
                .u64(timestamp)
                .u64(height)
                .digest();
        return Hashes.toHex(hash);
    }

    /**
     * 에스크로 ID 생성
     * Escrow id = H(order_id ‖ fill_id ‖ timestamp ‖ fill_counter)
     */
    public String escrowId(String orderId, String fillId, long timestamp, long fillCounter) {
        byte[] hash = new Hashes.Preimage()
                .bytes(Hashes.parseHash(orderId, "orderId"))
                .bytes(Hashes.parseHash(fillId, "fillId"))
                .u64(timestamp)
                .u64(fillCounter)
                .digest();
        return Hashes.toHex(hash);
    }
}
