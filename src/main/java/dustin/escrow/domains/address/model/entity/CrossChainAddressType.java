package dustin.escrow.domains.address.model.entity;

/**
 * 상대 체인 주소 유형
 * Cross-chain address type
 */
public enum CrossChainAddressType {

    /** 20바이트 */
    ETHEREUM(20),

    /** 32바이트 */
    SUBSTRATE(32),

    /** 1 ~ 256 바이트 */
    RAW(-1);

    public static final int MAX_RAW_LENGTH = 256;

    private final int expectedLength;

    CrossChainAddressType(int expectedLength) {
        this.expectedLength = expectedLength;
    }

    public boolean accepts(int length) {
        if (length <= 0) {
            return false;
        }
        return expectedLength < 0 ? length <= MAX_RAW_LENGTH : expectedLength == length;
    }

    public int getExpectedLength() {
        return expectedLength;
    }
}
