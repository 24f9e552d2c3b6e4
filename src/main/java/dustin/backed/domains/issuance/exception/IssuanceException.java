package dustin.backed.domains.issuance.exception;

/**
 * 발행 관련 예외
 * Issuance-related exception
 *
 * 모든 에러는 동기적으로 호출자에게 전달됩니다.
 * 설정 오류(스프레드 100% 이상 등)는 INVALID_INPUT으로 보고합니다.
 */
public class IssuanceException extends RuntimeException {

    private final IssuanceErrorCode code;

    public IssuanceException(IssuanceErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public IssuanceException(IssuanceErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public IssuanceErrorCode getCode() {
        return code;
    }

    public static IssuanceException invalidInput(String message) {
        return new IssuanceException(IssuanceErrorCode.INVALID_INPUT, message);
    }

    public static IssuanceException insufficientBalance(String message) {
        return new IssuanceException(IssuanceErrorCode.INSUFFICIENT_BALANCE, message);
    }

    public static IssuanceException externalCallFailure(String message, Throwable cause) {
        return new IssuanceException(IssuanceErrorCode.EXTERNAL_CALL_FAILURE, message, cause);
    }

    public static IssuanceException unauthorized(String message) {
        return new IssuanceException(IssuanceErrorCode.UNAUTHORIZED, message);
    }
}
