package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;
import java.util.Objects;

import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * 가격 파라미터
 * Pricing Parameters
 *
 * - buySpread / redeemSpread: 스케일 P 비율 (기준가에 가산/차감)
 * - buyFee / redeemFee: 준비자산 단위 고정 수수료
 *
 * 불변 객체이며 설정 권한자만 새 인스턴스로 교체합니다.
 */
public final class PricingParameters {

    public static final PricingParameters ZERO =
            new PricingParameters(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);

    private final BigInteger buySpread;
    private final BigInteger redeemSpread;
    private final BigInteger buyFee;
    private final BigInteger redeemFee;

    /**
     * @throws IssuanceException 음수/범위 초과 또는 redeemSpread &gt;= P (설정 오류)
     */
    public PricingParameters(BigInteger buySpread, BigInteger redeemSpread, BigInteger buyFee, BigInteger redeemFee) {
        this.buySpread = FixedPoint.requireUint256(buySpread, "buySpread");
        this.redeemSpread = FixedPoint.requireUint256(redeemSpread, "redeemSpread");
        this.buyFee = FixedPoint.requireUint256(buyFee, "buyFee");
        this.redeemFee = FixedPoint.requireUint256(redeemFee, "redeemFee");
        if (redeemSpread.compareTo(FixedPoint.SCALE) >= 0) {
            throw IssuanceException.invalidInput("redeemSpread must be below 100%: " + redeemSpread);
        }
    }

    public BigInteger getBuySpread() {
        return buySpread;
    }

    public BigInteger getRedeemSpread() {
        return redeemSpread;
    }

    public BigInteger getBuyFee() {
        return buyFee;
    }

    public BigInteger getRedeemFee() {
        return redeemFee;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PricingParameters that = (PricingParameters) o;
        return buySpread.equals(that.buySpread) && redeemSpread.equals(that.redeemSpread)
                && buyFee.equals(that.buyFee) && redeemFee.equals(that.redeemFee);
    }

    @Override
    public int hashCode() {
        return Objects.hash(buySpread, redeemSpread, buyFee, redeemFee);
    }

    @Override
    public String toString() {
        return "PricingParameters{buySpread=" + buySpread + ", redeemSpread=" + redeemSpread
                + ", buyFee=" + buyFee + ", redeemFee=" + redeemFee + "}";
    }
}
