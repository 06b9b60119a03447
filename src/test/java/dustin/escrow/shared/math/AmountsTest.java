package dustin.escrow.shared.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;

class AmountsTest {

    @Test
    @DisplayName("u128 범위를 벗어난 입력 금액은 INVALID_AMOUNT")
    void requireAmountRejectsOutOfRange() {
        assertThatThrownBy(() -> Amounts.requireAmount(BigInteger.valueOf(-1), "amount"))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.INVALID_AMOUNT);
        assertThatThrownBy(() -> Amounts.requireAmount(Amounts.MAX_AMOUNT.add(BigInteger.ONE), "amount"))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.INVALID_AMOUNT);
        assertThatThrownBy(() -> Amounts.requireAmount(null, "amount"))
                .isInstanceOf(EscrowException.class);

        assertThat(Amounts.requireAmount(Amounts.MAX_AMOUNT, "amount")).isEqualTo(Amounts.MAX_AMOUNT);
    }

    @Test
    @DisplayName("덧셈/뺄셈/곱셈 결과가 범위를 벗어나면 ARITHMETIC_OVERFLOW")
    void checkedArithmeticOverflows() {
        assertThatThrownBy(() -> Amounts.checkedAdd(Amounts.MAX_AMOUNT, BigInteger.ONE))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.ARITHMETIC_OVERFLOW);
        assertThatThrownBy(() -> Amounts.checkedSub(BigInteger.ONE, BigInteger.TWO))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.ARITHMETIC_OVERFLOW);
        assertThatThrownBy(() -> Amounts.checkedMul(Amounts.MAX_AMOUNT, BigInteger.TWO))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.ARITHMETIC_OVERFLOW);

        assertThat(Amounts.checkedAdd(BigInteger.TEN, BigInteger.ONE)).isEqualTo(BigInteger.valueOf(11));
        assertThat(Amounts.checkedSub(BigInteger.TEN, BigInteger.TEN)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("카운터 증가 오버플로우")
    void incrementOverflow() {
        assertThat(Amounts.increment(41L)).isEqualTo(42L);
        assertThatThrownBy(() -> Amounts.increment(Long.MAX_VALUE))
                .isInstanceOf(EscrowException.class)
                .extracting("code").isEqualTo(EscrowErrorCode.ARITHMETIC_OVERFLOW);
    }

    @Test
    @DisplayName("목적 체인 환산 금액은 1e12 스케일에서 버림")
    void scaleByRate() {
        // 2.5 per unit
        BigInteger rate = new BigInteger("2500000000000");
        assertThat(Amounts.scaleByRate(BigInteger.valueOf(200), rate)).isEqualTo(BigInteger.valueOf(500));
        // 0.333333333333 per unit, 10 units -> 3.33 -> 3
        assertThat(Amounts.scaleByRate(BigInteger.TEN, new BigInteger("333333333333"))).isEqualTo(BigInteger.valueOf(3));
    }
}
