// =====================================================
// PricingEngine - 오라클 가격 → 체결 가격 변환
// =====================================================
// 역할: 오라클 원본 가격에 스프레드를 적용하고 고정 수수료를 붙임
//
// 공식 (스케일 P = 10^18):
// - 매수: execPrice = base + base * buySpread / P
// - 상환: execPrice = base - base * redeemSpread / P
//
// 규칙:
// 1. base <= 0 이면 입력 오류
// 2. 결과 execPrice <= 0 이면 설정 오류 → INVALID_INPUT (클램프하지 않음)
// 3. 상태 없음 (파라미터는 호출마다 스냅샷으로 전달)
// =====================================================

package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;

import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * 가격 엔진
 * Pricing Engine
 */
public class PricingEngine {

    /**
     * 매수 견적
     *
     * @param basePrice 오라클 가격 (스케일 P)
     * @param params 가격 파라미터 스냅샷
     * @return 체결 가격과 매수 수수료
     */
    public Quote buyQuote(BigInteger basePrice, PricingParameters params) {
        requirePositivePrice(basePrice);
        BigInteger markup = FixedPoint.mulDiv(basePrice, params.getBuySpread(), FixedPoint.SCALE);
        BigInteger execPrice = basePrice.add(markup);
        return new Quote(basePrice, requireExecPrice(execPrice), params.getBuyFee());
    }

    /**
     * 상환 견적
     *
     * @param basePrice 오라클 가격 (스케일 P)
     * @param params 가격 파라미터 스냅샷
     * @return 체결 가격과 상환 수수료
     * @throws IssuanceException redeemSpread가 가격을 0 이하로 만드는 경우
     */
    public Quote redeemQuote(BigInteger basePrice, PricingParameters params) {
        requirePositivePrice(basePrice);
        BigInteger markdown = FixedPoint.mulDiv(basePrice, params.getRedeemSpread(), FixedPoint.SCALE);
        BigInteger execPrice = basePrice.subtract(markdown);
        return new Quote(basePrice, requireExecPrice(execPrice), params.getRedeemFee());
    }

    /**
     * 준비자산 → 토큰 수량 (net * P / execPrice)
     */
    public BigInteger tokensForReserve(BigInteger reserveAmount, BigInteger execPrice) {
        return FixedPoint.mulDiv(reserveAmount, FixedPoint.SCALE, requireExecPrice(execPrice));
    }

    /**
     * 토큰 → 준비자산 수량 (tokens * execPrice / P)
     */
    public BigInteger reserveForTokens(BigInteger tokenAmount, BigInteger execPrice) {
        return FixedPoint.mulDiv(tokenAmount, requireExecPrice(execPrice), FixedPoint.SCALE);
    }

    private static void requirePositivePrice(BigInteger basePrice) {
        if (basePrice == null || basePrice.signum() <= 0) {
            throw IssuanceException.invalidInput("Oracle price must be positive: " + basePrice);
        }
    }

    private static BigInteger requireExecPrice(BigInteger execPrice) {
        if (execPrice.signum() <= 0) {
            throw IssuanceException.invalidInput("Execution price must be positive: " + execPrice);
        }
        return execPrice;
    }
}
