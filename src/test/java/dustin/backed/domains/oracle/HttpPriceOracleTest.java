package dustin.backed.domains.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.backed.config.IssuerProperties;
import dustin.backed.domains.issuance.exception.IssuanceErrorCode;
import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * HTTP 가격 오라클 응답 파싱 테스트
 *
 * 피드 가격은 decimals 자리 정수, 결과는 10^18 스케일
 */
class HttpPriceOracleTest {

    private IssuerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new IssuerProperties();
        properties.getOracle().getHttp().setDecimals(8);
    }

    private HttpPriceOracle oracle() {
        HttpPriceOracle oracle = new HttpPriceOracle(properties);
        oracle.init();
        return oracle;
    }

    @Test
    @DisplayName("8자리 피드 가격을 10^18 스케일로 변환")
    void rescalesFeedPrice() {
        assertThat(oracle().parsePrice("{\"price\":\"125000000\"}"))
                .isEqualTo(new BigInteger("1250000000000000000"));
    }

    @Test
    @DisplayName("필드 이름은 설정값 사용")
    void usesConfiguredField() {
        properties.getOracle().getHttp().setPriceField("answer");

        assertThat(oracle().parsePrice("{\"answer\":100000000}")).isEqualTo(BigInteger.TEN.pow(18));
    }

    @Test
    @DisplayName("필드 누락 / 잘못된 응답 / URL 미설정은 EXTERNAL_CALL_FAILURE")
    void malformedResponsesFail() {
        HttpPriceOracle oracle = oracle();

        assertThatThrownBy(() -> oracle.parsePrice("{\"other\":1}"))
                .isInstanceOf(IssuanceException.class)
                .extracting(e -> ((IssuanceException) e).getCode())
                .isEqualTo(IssuanceErrorCode.EXTERNAL_CALL_FAILURE);
        assertThatThrownBy(() -> oracle.parsePrice("not json"))
                .isInstanceOf(IssuanceException.class);
        assertThatThrownBy(() -> oracle.parsePrice("{\"price\":\"abc\"}"))
                .isInstanceOf(IssuanceException.class);
        assertThatThrownBy(oracle::getPrice)
                .isInstanceOf(IssuanceException.class)
                .hasMessageContaining("not configured");
    }
}
