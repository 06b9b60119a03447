package dustin.escrow.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * 전역 예외 처리기
 * Global Exception Handler
 *
 * EscrowErrorKind를 HTTP 상태 코드로 변환합니다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EscrowException.class)
    public ResponseEntity<Map<String, String>> handleEscrowException(EscrowException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("kind", e.getKind().name());
        error.put("code", e.getCode().name());

        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.warn("[GlobalExceptionHandler] 작업 실패: code={}, message={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> error = new HashMap<>();
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        error.put("error", message);
        error.put("kind", EscrowErrorKind.INVALID_PARAMETER.name());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    private HttpStatus statusOf(EscrowErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case UNAUTHORIZED:
                return HttpStatus.FORBIDDEN;
            case INVALID_PARAMETER:
                return HttpStatus.BAD_REQUEST;
            case ALREADY_EXISTS:
            case STATE_CONFLICT:
            case TIMING_VIOLATION:
                return HttpStatus.CONFLICT;
            case SECRET_MISMATCH:
            case ARITHMETIC_OVERFLOW:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSFER_FAILURE:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
