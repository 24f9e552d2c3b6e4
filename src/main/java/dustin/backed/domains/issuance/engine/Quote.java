package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;

/**
 * 체결 가격 + 고정 수수료
 * Execution price and fee
 */
public final class Quote {

    private final BigInteger basePrice;
    private final BigInteger execPrice;
    private final BigInteger fee;

    public Quote(BigInteger basePrice, BigInteger execPrice, BigInteger fee) {
        this.basePrice = basePrice;
        this.execPrice = execPrice;
        this.fee = fee;
    }

    /**
     * 오라클 원본 가격 (스케일 P)
     */
    public BigInteger getBasePrice() {
        return basePrice;
    }

    /**
     * 스프레드 적용 가격 (스케일 P, 항상 양수)
     */
    public BigInteger getExecPrice() {
        return execPrice;
    }

    public BigInteger getFee() {
        return fee;
    }

    @Override
    public String toString() {
        return "Quote{basePrice=" + basePrice + ", execPrice=" + execPrice + ", fee=" + fee + "}";
    }
}
