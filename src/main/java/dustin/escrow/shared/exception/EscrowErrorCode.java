package dustin.escrow.shared.exception;

/**
 * 에스크로 오류 코드
 * Escrow Error Code
 *
 * 세부 오류 코드와 그 분류(EscrowErrorKind), 기본 메시지
 */
public enum EscrowErrorCode {

    // NOT_FOUND
    ORDER_NOT_FOUND(EscrowErrorKind.NOT_FOUND, "Order not found"),
    FILL_NOT_FOUND(EscrowErrorKind.NOT_FOUND, "Fill not found"),
    ADDRESS_NOT_FOUND(EscrowErrorKind.NOT_FOUND, "Cross-chain address not mapped"),

    // ALREADY_EXISTS
    ORDER_ALREADY_EXISTS(EscrowErrorKind.ALREADY_EXISTS, "Order id already exists"),
    FILL_ALREADY_EXISTS(EscrowErrorKind.ALREADY_EXISTS, "Fill id already exists"),

    // UNAUTHORIZED
    UNAUTHORIZED_WITHDRAW(EscrowErrorKind.UNAUTHORIZED, "Only the taker can withdraw this fill"),
    UNAUTHORIZED_REFUND(EscrowErrorKind.UNAUTHORIZED, "Only the maker can refund this fill"),
    UNAUTHORIZED_CANCEL(EscrowErrorKind.UNAUTHORIZED, "Only the maker can cancel this order"),
    NOT_ADMIN(EscrowErrorKind.UNAUTHORIZED, "Caller is not the protocol admin"),

    // INVALID_PARAMETER
    INVALID_TIMELOCK(EscrowErrorKind.INVALID_PARAMETER, "Timelock must be in the future"),
    TIMELOCK_TOO_SHORT(EscrowErrorKind.INVALID_PARAMETER, "Timelock is shorter than the minimum"),
    TIMELOCK_TOO_LONG(EscrowErrorKind.INVALID_PARAMETER, "Timelock is longer than the maximum"),
    INVALID_CHAIN_PAIR(EscrowErrorKind.INVALID_PARAMETER, "Source and destination chain must differ"),
    INVALID_MIN_FILL_AMOUNT(EscrowErrorKind.INVALID_PARAMETER, "Min fill amount must be positive and not exceed total amount"),
    INVALID_MAX_FILLS(EscrowErrorKind.INVALID_PARAMETER, "Max fills must be positive"),
    INVALID_FILL_AMOUNT(EscrowErrorKind.INVALID_PARAMETER, "Fill amount must be positive"),
    FILL_AMOUNT_TOO_SMALL(EscrowErrorKind.INVALID_PARAMETER, "Fill amount is below the order minimum"),
    INSUFFICIENT_DEPOSIT(EscrowErrorKind.INVALID_PARAMETER, "Attached value does not cover the order amount"),
    INVALID_FEE_RATE(EscrowErrorKind.INVALID_PARAMETER, "Fee rate must be between 0 and 1000 bps"),
    INVALID_AMOUNT(EscrowErrorKind.INVALID_PARAMETER, "Amount is outside the 128-bit unsigned range"),
    MALFORMED_HEX(EscrowErrorKind.INVALID_PARAMETER, "Malformed hex value"),
    INVALID_ACCOUNT(EscrowErrorKind.INVALID_PARAMETER, "Account identity must not be blank"),

    // STATE_CONFLICT
    ORDER_CANCELLED(EscrowErrorKind.STATE_CONFLICT, "Order is cancelled"),
    ORDER_COMPLETED(EscrowErrorKind.STATE_CONFLICT, "Order is completely filled"),
    MAX_FILLS_REACHED(EscrowErrorKind.STATE_CONFLICT, "Order reached its maximum number of fills"),
    PARTIAL_FILLS_NOT_ALLOWED(EscrowErrorKind.STATE_CONFLICT, "Order must be filled in full"),
    FILL_ALREADY_SETTLED(EscrowErrorKind.STATE_CONFLICT, "Fill is already withdrawn or refunded"),
    NO_FEES_ACCRUED(EscrowErrorKind.STATE_CONFLICT, "No protocol fees to sweep"),

    // TIMING_VIOLATION
    TIMELOCK_EXPIRED(EscrowErrorKind.TIMING_VIOLATION, "Timelock has expired"),
    TIMELOCK_NOT_EXPIRED(EscrowErrorKind.TIMING_VIOLATION, "Timelock has not expired yet"),

    // SECRET_MISMATCH
    SECRET_MISMATCH(EscrowErrorKind.SECRET_MISMATCH, "Preimage does not match hashlock"),

    // ARITHMETIC_OVERFLOW
    ARITHMETIC_OVERFLOW(EscrowErrorKind.ARITHMETIC_OVERFLOW, "Arithmetic overflow"),

    // TRANSFER_FAILURE
    TRANSFER_FAILED(EscrowErrorKind.TRANSFER_FAILURE, "Value transfer failed");

    private final EscrowErrorKind kind;
    private final String defaultMessage;

    EscrowErrorCode(EscrowErrorKind kind, String defaultMessage) {
        this.kind = kind;
        this.defaultMessage = defaultMessage;
    }

    public EscrowErrorKind getKind() {
        return kind;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
