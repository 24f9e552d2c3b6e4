package dustin.backed.domains.issuance.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.backed.domains.issuance.exception.IssuanceErrorCode;
import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * 가격 엔진 테스트
 *
 * 목적:
 * - 스프레드/수수료 적용 공식 검증 (곱셈 후 나눗셈, 정수 연산)
 * - 0 이하 가격, 100% 이상 상환 스프레드 거부
 * - 매수 후 즉시 상환 시 가치가 늘어나지 않는지 (스프레드/수수료 ≥ 0)
 */
class PricingEngineTest {

    private static final BigInteger P = FixedPoint.SCALE;
    private static final BigInteger ONE_PERCENT = P.divide(BigInteger.valueOf(100));

    private final PricingEngine pricingEngine = new PricingEngine();

    @Test
    @DisplayName("매수 견적: execPrice = base + base*buySpread/P, fee = buyFee")
    void buyQuoteAppliesMarkup() {
        PricingParameters params = new PricingParameters(ONE_PERCENT, BigInteger.ZERO, BigInteger.valueOf(3), BigInteger.ZERO);
        BigInteger base = BigInteger.valueOf(2).multiply(P);

        Quote quote = pricingEngine.buyQuote(base, params);

        assertThat(quote.getBasePrice()).isEqualTo(base);
        assertThat(quote.getExecPrice()).isEqualTo(new BigInteger("2020000000000000000"));
        assertThat(quote.getFee()).isEqualTo(BigInteger.valueOf(3));
    }

    @Test
    @DisplayName("상환 견적: execPrice = base - base*redeemSpread/P, fee = redeemFee")
    void redeemQuoteAppliesMarkdown() {
        PricingParameters params = new PricingParameters(BigInteger.ZERO, ONE_PERCENT.multiply(BigInteger.valueOf(5)),
                BigInteger.ZERO, BigInteger.valueOf(7));

        Quote quote = pricingEngine.redeemQuote(P, params);

        assertThat(quote.getExecPrice()).isEqualTo(new BigInteger("950000000000000000"));
        assertThat(quote.getFee()).isEqualTo(BigInteger.valueOf(7));
    }

    @Test
    @DisplayName("곱셈을 먼저 하므로 작은 가격에서도 스프레드가 사라지지 않음")
    void multipliesBeforeDividing() {
        PricingParameters params = new PricingParameters(P.divide(BigInteger.TWO), BigInteger.ZERO,
                BigInteger.ZERO, BigInteger.ZERO);

        Quote quote = pricingEngine.buyQuote(BigInteger.valueOf(3), params);

        // 3 + 3 * 0.5 = 4 (내림)
        assertThat(quote.getExecPrice()).isEqualTo(BigInteger.valueOf(4));
    }

    @Test
    @DisplayName("기준 가격이 0 이하이면 INVALID_INPUT")
    void rejectsNonPositiveBasePrice() {
        assertThatThrownBy(() -> pricingEngine.buyQuote(BigInteger.ZERO, PricingParameters.ZERO))
                .isInstanceOf(IssuanceException.class)
                .extracting(e -> ((IssuanceException) e).getCode())
                .isEqualTo(IssuanceErrorCode.INVALID_INPUT);
        assertThatThrownBy(() -> pricingEngine.redeemQuote(BigInteger.valueOf(-1), PricingParameters.ZERO))
                .isInstanceOf(IssuanceException.class);
    }

    @Test
    @DisplayName("redeemSpread >= P는 설정 오류 (클램프하지 않음)")
    void rejectsFullRedeemSpread() {
        assertThatThrownBy(() -> new PricingParameters(BigInteger.ZERO, P, BigInteger.ZERO, BigInteger.ZERO))
                .isInstanceOf(IssuanceException.class)
                .hasMessageContaining("redeemSpread");
    }

    @Test
    @DisplayName("redeemSpread = P-1 경계에서도 체결 가격은 양수")
    void redeemSpreadBoundaryKeepsPositivePrice() {
        PricingParameters params = new PricingParameters(BigInteger.ZERO, P.subtract(BigInteger.ONE),
                BigInteger.ZERO, BigInteger.ZERO);

        // base = 1 → markdown = 1 * (P-1) / P = 0 → execPrice 1 (허용)
        assertThat(pricingEngine.redeemQuote(BigInteger.ONE, params).getExecPrice()).isEqualTo(BigInteger.ONE);

        // base = P → markdown = P-1 → execPrice 1
        assertThat(pricingEngine.redeemQuote(P, params).getExecPrice()).isEqualTo(BigInteger.ONE);
    }

    @Test
    @DisplayName("uint256 범위 밖 파라미터는 INVALID_INPUT")
    void rejectsOutOfRangeParameters() {
        BigInteger tooLarge = FixedPoint.UINT256_MAX.add(BigInteger.ONE);
        assertThatThrownBy(() -> new PricingParameters(tooLarge, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO))
                .isInstanceOf(IssuanceException.class);
        assertThatThrownBy(() -> new PricingParameters(BigInteger.ZERO, BigInteger.ZERO, BigInteger.valueOf(-1), BigInteger.ZERO))
                .isInstanceOf(IssuanceException.class);
    }

    @Test
    @DisplayName("매수 후 같은 가격으로 상환하면 넣은 금액 이하만 돌려받음")
    void roundTripNeverGainsValue() {
        PricingParameters params = new PricingParameters(ONE_PERCENT, ONE_PERCENT, BigInteger.valueOf(2), BigInteger.valueOf(2));
        BigInteger base = new BigInteger("1234567890123456789");
        BigInteger[] deposits = {
                BigInteger.valueOf(10),
                BigInteger.valueOf(1_000),
                new BigInteger("1000000000000000000000"),
                new BigInteger("987654321987654321")
        };

        for (BigInteger deposit : deposits) {
            Quote buy = pricingEngine.buyQuote(base, params);
            BigInteger tokens = pricingEngine.tokensForReserve(deposit.subtract(buy.getFee()), buy.getExecPrice());

            Quote redeem = pricingEngine.redeemQuote(base, params);
            BigInteger gross = pricingEngine.reserveForTokens(tokens, redeem.getExecPrice());
            BigInteger payout = gross.subtract(redeem.getFee()).max(BigInteger.ZERO);

            assertThat(payout).isLessThanOrEqualTo(deposit);
        }
    }

    @Test
    @DisplayName("스프레드/수수료 0이면 1.0이 아닌 가격에서도 왕복 손실은 정수 나눗셈 나머지 이내")
    void zeroSpreadRoundTripLosesOnlyRounding() {
        BigInteger base = new BigInteger("1234567890123456789");
        Quote buy = pricingEngine.buyQuote(base, PricingParameters.ZERO);
        Quote redeem = pricingEngine.redeemQuote(base, PricingParameters.ZERO);
        assertThat(buy.getExecPrice()).isEqualTo(base);
        assertThat(redeem.getExecPrice()).isEqualTo(base);

        // 토큰 환산에서 1 토큰 미만(가격/P), 준비자산 환산에서 1 미만 절사
        BigInteger maxLoss = base.divide(P).add(BigInteger.ONE);
        BigInteger[] deposits = {
                BigInteger.valueOf(2),
                BigInteger.valueOf(1_000),
                new BigInteger("1000000000000000000000"),
                new BigInteger("987654321987654321")
        };

        for (BigInteger deposit : deposits) {
            BigInteger tokens = pricingEngine.tokensForReserve(deposit, buy.getExecPrice());
            BigInteger payout = pricingEngine.reserveForTokens(tokens, redeem.getExecPrice());

            assertThat(payout).isLessThanOrEqualTo(deposit);
            assertThat(deposit.subtract(payout)).isLessThanOrEqualTo(maxLoss);
        }
    }

    @Test
    @DisplayName("스프레드/수수료 0이면 가격 1.0에서 준비자산과 토큰이 1:1")
    void zeroSpreadIsOneToOneAtUnitPrice() {
        Quote quote = pricingEngine.buyQuote(P, PricingParameters.ZERO);

        assertThat(pricingEngine.tokensForReserve(BigInteger.valueOf(100), quote.getExecPrice()))
                .isEqualTo(BigInteger.valueOf(100));
        assertThat(pricingEngine.reserveForTokens(BigInteger.valueOf(100), quote.getExecPrice()))
                .isEqualTo(BigInteger.valueOf(100));
    }
}
