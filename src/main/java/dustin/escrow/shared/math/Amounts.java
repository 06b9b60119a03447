package dustin.escrow.shared.math;

import java.math.BigInteger;

import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;

/**
 * 128비트 부호 없는 금액 연산
 * Checked u128 amount arithmetic
 *
 * 모든 금액은 [0, 2^128 - 1] 범위의 정수입니다.
 * 범위를 벗어나는 결과는 잘라내지 않고 ARITHMETIC_OVERFLOW 오류로 처리합니다.
 */
public final class Amounts {

    /**
     * 금액 최대값 (2^128 - 1)
     */
    public static final BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    /**
     * dest_amount_per_unit 스케일 (1e12)
     */
    public static final BigInteger RATE_SCALE = BigInteger.TEN.pow(12);

    private Amounts() {
    }

    /**
     * 외부 입력 금액 검증 (null, 음수, 범위 초과 거부)
     *
     * @param value 입력 금액
     * @param field 오류 메시지용 필드명
     * @return 검증된 금액
     */
    public static BigInteger requireAmount(BigInteger value, String field) {
        if (value == null || value.signum() < 0 || value.compareTo(MAX_AMOUNT) > 0) {
            throw new EscrowException(EscrowErrorCode.INVALID_AMOUNT,
                    field + " must be within [0, 2^128-1]: " + value);
        }
        return value;
    }

    public static BigInteger checkedAdd(BigInteger a, BigInteger b) {
        return checkRange(a.add(b), "add");
    }

    public static BigInteger checkedSub(BigInteger a, BigInteger b) {
        return checkRange(a.subtract(b), "sub");
    }

    public static BigInteger checkedMul(BigInteger a, BigInteger b) {
        return checkRange(a.multiply(b), "mul");
    }

    /**
     * 카운터 증가 (u64 의미, long 범위 초과 시 오류)
     */
    public static long increment(long counter) {
        try {
            return Math.addExact(counter, 1L);
        } catch (ArithmeticException e) {
            throw new EscrowException(EscrowErrorCode.ARITHMETIC_OVERFLOW, "Counter overflow", e);
        }
    }

    /**
     * 목적지 체인 환산 금액 (amount * rate / 1e12, 버림)
     */
    public static BigInteger scaleByRate(BigInteger amount, BigInteger ratePerUnit) {
        return checkedMul(amount, ratePerUnit).divide(RATE_SCALE);
    }

    private static BigInteger checkRange(BigInteger result, String op) {
        if (result.signum() < 0 || result.compareTo(MAX_AMOUNT) > 0) {
            throw new EscrowException(EscrowErrorCode.ARITHMETIC_OVERFLOW, "Amount " + op + " out of u128 range");
        }
        return result;
    }
}
