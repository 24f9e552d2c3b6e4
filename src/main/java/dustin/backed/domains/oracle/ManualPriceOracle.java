package dustin.backed.domains.oracle;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;

import dustin.backed.domains.issuance.engine.FixedPoint;
import lombok.extern.slf4j.Slf4j;

/**
 * 수동 설정 가격 오라클
 * Manually set price oracle
 *
 * 운영자가 관리 API로 가격을 설정합니다. 기본값 1.0 (= P)
 */
@Slf4j
@Component(ManualPriceOracle.NAME)
public class ManualPriceOracle implements PriceOracle {

    public static final String NAME = "manualOracle";

    private final AtomicReference<BigInteger> price = new AtomicReference<>(FixedPoint.SCALE);

    @Override
    public BigInteger getPrice() {
        return price.get();
    }

    /**
     * 가격 설정 (0 이하 가격도 저장은 하되, 견적 시점에 거부됨)
     */
    public void setPrice(BigInteger newPrice) {
        BigInteger previous = price.getAndSet(newPrice);
        log.info("[ManualPriceOracle] 가격 변경: {} -> {}", previous, newPrice);
    }
}
