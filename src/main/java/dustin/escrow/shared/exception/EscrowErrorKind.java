package dustin.escrow.shared.exception;

/**
 * 에스크로 오류 분류
 * Escrow Error Kind
 *
 * 모든 EscrowErrorCode는 정확히 하나의 분류에 속합니다.
 * 테스트와 API 응답은 이 분류로 오류를 매칭합니다.
 */
public enum EscrowErrorKind {

    /** 주문 또는 체결 없음 (order/fill absent) */
    NOT_FOUND,

    /** 식별자 충돌 (id collision) */
    ALREADY_EXISTS,

    /** 요청한 작업의 호출자가 아님 (wrong caller) */
    UNAUTHORIZED,

    /** 잘못된 파라미터 (timelock 범위, 체인 쌍, 체결 수량 범위 등) */
    INVALID_PARAMETER,

    /** 상태 충돌 (취소됨, 완료됨, 최대 체결 수 도달, 이미 정산된 체결 등) */
    STATE_CONFLICT,

    /** timelock 위반 (만료 전 환불, 만료 후 출금/체결) */
    TIMING_VIOLATION,

    /** 공개된 secret이 hashlock과 일치하지 않음 */
    SECRET_MISMATCH,

    /** 수수료/잔고 계산 오버플로우 */
    ARITHMETIC_OVERFLOW,

    /** 가치 이체 실패 */
    TRANSFER_FAILURE
}
