package dustin.backed.domains.issuance.exception;

/**
 * 발행 엔진 에러 코드
 * Issuance Error Code
 */
public enum IssuanceErrorCode {

    /**
     * 잘못된 입력 (0 수량, 0 이하 가격, 수수료 이하 금액, 잘못된 설정값)
     */
    INVALID_INPUT,

    /**
     * 잔고 부족 (보유량 초과 소각, 버퍼 초과 출금)
     */
    INSUFFICIENT_BALANCE,

    /**
     * 외부 호출 실패 (브릿지 전송, 오라클 조회, 준비자산 이체)
     */
    EXTERNAL_CALL_FAILURE,

    /**
     * 권한 없음 (owner/operator 전용 작업)
     */
    UNAUTHORIZED
}
