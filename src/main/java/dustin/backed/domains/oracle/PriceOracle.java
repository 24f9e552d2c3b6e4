package dustin.backed.domains.oracle;

import java.math.BigInteger;

/**
 * 가격 오라클
 * Price Oracle
 *
 * 토큰 1개당 준비자산 비율을 스케일 P(10^18) 정수로 반환합니다.
 * 조회 불가 시 EXTERNAL_CALL_FAILURE를 던집니다.
 * 0 이하 가격 검증은 호출자(PricingEngine)가 수행합니다.
 */
public interface PriceOracle {

    BigInteger getPrice();
}
