package dustin.backed.domains.issuance.exception;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import lombok.extern.slf4j.Slf4j;

/**
 * 발행 API 예외 처리기
 * Issuance Exception Handler
 *
 * 에러 코드 → HTTP 상태:
 * - INVALID_INPUT → 400
 * - INSUFFICIENT_BALANCE → 409
 * - EXTERNAL_CALL_FAILURE → 502
 * - UNAUTHORIZED → 403
 * - 요청 검증 실패 (Bean Validation, 헤더/파라미터 누락, 형식 오류) → 400
 *
 * 응답 본문: {"code": "...", "error": "..."}
 */
@Slf4j
@RestControllerAdvice
public class IssuanceExceptionHandler {

    @ExceptionHandler(IssuanceException.class)
    public ResponseEntity<Map<String, String>> handleIssuanceException(IssuanceException e) {
        HttpStatus status;
        switch (e.getCode()) {
            case INSUFFICIENT_BALANCE:
                status = HttpStatus.CONFLICT;
                break;
            case EXTERNAL_CALL_FAILURE:
                status = HttpStatus.BAD_GATEWAY;
                log.warn("[IssuanceExceptionHandler] 외부 호출 실패: {}", e.getMessage(), e);
                break;
            case UNAUTHORIZED:
                status = HttpStatus.FORBIDDEN;
                break;
            case INVALID_INPUT:
            default:
                status = HttpStatus.BAD_REQUEST;
                break;
        }
        return ResponseEntity.status(status).body(body(e.getCode().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(body(IssuanceErrorCode.INVALID_INPUT.name(), message));
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(body(IssuanceErrorCode.INVALID_INPUT.name(), e.getMessage()));
    }

    /**
     * JSON 본문 파싱 실패 (계정 형식 오류 포함)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause instanceof IssuanceException ? cause.getMessage() : "Malformed request body";
        return ResponseEntity.badRequest().body(body(IssuanceErrorCode.INVALID_INPUT.name(), message));
    }

    private static Map<String, String> body(String code, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("code", code);
        error.put("error", message);
        return error;
    }
}
