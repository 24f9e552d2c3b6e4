// =====================================================
// FixedPoint - 고정소수점 정수 연산
// =====================================================
// 역할: 가격/스프레드는 10^18 스케일 정수로 표현
//
// 핵심 설계:
// 1. BigInteger 사용 (256비트 곱셈 중간값도 오버플로 없음)
// 2. 곱셈 먼저, 나눗셈 나중 (정밀도 보존)
// 3. 나눗셈은 버림 (floor), 음수는 다루지 않음
// 4. 모든 수량은 uint256 범위 [0, 2^256) 이내여야 함
// =====================================================

package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;

import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * 고정소수점 연산 유틸리티
 * Fixed-point arithmetic helpers
 *
 * 예시:
 * <pre>
 * // 1.5 (스케일 P)
 * BigInteger price = FixedPoint.SCALE.multiply(BigInteger.valueOf(3)).divide(BigInteger.TWO);
 * // 100 * 1.5 = 150
 * FixedPoint.mulDiv(BigInteger.valueOf(100), price, FixedPoint.SCALE);
 * </pre>
 */
public final class FixedPoint {

    /**
     * P = 10^18
     */
    public static final BigInteger SCALE = BigInteger.TEN.pow(18);

    /**
     * 2^256 - 1
     */
    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private FixedPoint() {
    }

    /**
     * a * b / d (버림)
     *
     * @throws IssuanceException d가 0 이하일 때
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger d) {
        if (d.signum() <= 0) {
            throw IssuanceException.invalidInput("Division by non-positive value: " + d);
        }
        return a.multiply(b).divide(d);
    }

    /**
     * uint256 범위 검증
     *
     * @param value 검증할 값
     * @param name 에러 메시지용 필드명
     * @return 입력값 그대로
     */
    public static BigInteger requireUint256(BigInteger value, String name) {
        if (value == null) {
            throw IssuanceException.invalidInput(name + " is required");
        }
        if (value.signum() < 0 || value.compareTo(UINT256_MAX) > 0) {
            throw IssuanceException.invalidInput(name + " out of uint256 range: " + value);
        }
        return value;
    }

    /**
     * 양수 uint256 검증 (0 거부)
     */
    public static BigInteger requirePositive(BigInteger value, String name) {
        requireUint256(value, name);
        if (value.signum() == 0) {
            throw IssuanceException.invalidInput(name + " must be greater than zero");
        }
        return value;
    }
}
