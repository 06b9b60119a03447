package dustin.escrow.shared.exception;

/**
 * 에스크로 작업 예외
 * Escrow operation exception
 *
 * 작업을 중단시키는 모든 오류는 이 예외로 전달됩니다.
 * 트랜잭션 안에서 발생하면 해당 작업의 변경 사항은 모두 롤백됩니다.
 */
public class EscrowException extends RuntimeException {

    private final EscrowErrorCode code;

    public EscrowException(EscrowErrorCode code) {
        super(code.getDefaultMessage());
        this.code = code;
    }

    public EscrowException(EscrowErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EscrowException(EscrowErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public EscrowErrorCode getCode() {
        return code;
    }

    public EscrowErrorKind getKind() {
        return code.getKind();
    }
}
