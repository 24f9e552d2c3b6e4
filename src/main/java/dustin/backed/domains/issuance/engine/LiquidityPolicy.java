package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 유동성 정책
 * Liquidity Policy
 *
 * - bufferThreshold: 로컬에 항상 남겨두는 준비자산
 * - minBridgeAmount: 브릿지로 보낼 가치가 있는 최소 초과분 (소액 전송 방지)
 */
public final class LiquidityPolicy {

    public static final LiquidityPolicy ZERO = new LiquidityPolicy(BigInteger.ZERO, BigInteger.ZERO);

    private final BigInteger bufferThreshold;
    private final BigInteger minBridgeAmount;

    public LiquidityPolicy(BigInteger bufferThreshold, BigInteger minBridgeAmount) {
        this.bufferThreshold = FixedPoint.requireUint256(bufferThreshold, "bufferThreshold");
        this.minBridgeAmount = FixedPoint.requireUint256(minBridgeAmount, "minBridgeAmount");
    }

    public BigInteger getBufferThreshold() {
        return bufferThreshold;
    }

    public BigInteger getMinBridgeAmount() {
        return minBridgeAmount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LiquidityPolicy that = (LiquidityPolicy) o;
        return bufferThreshold.equals(that.bufferThreshold) && minBridgeAmount.equals(that.minBridgeAmount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bufferThreshold, minBridgeAmount);
    }

    @Override
    public String toString() {
        return "LiquidityPolicy{bufferThreshold=" + bufferThreshold + ", minBridgeAmount=" + minBridgeAmount + "}";
    }
}
