package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * 큐 처리 결과
 * Queue Process Result
 *
 * payouts 순서: 큐에서 꺼낸 요청들(FIFO) → 즉시 지급된 신규 요청
 * 호출자는 payouts의 모든 항목을 실제로 이체해야 합니다.
 */
public final class QueueProcessResult {

    private final List<RedemptionRequest> payouts;
    private final int dequeuedCount;
    private final RedemptionRequest newRequest;
    private final boolean newRequestPaid;
    private final BigInteger remainingLiquidity;

    QueueProcessResult(List<RedemptionRequest> payouts, int dequeuedCount, RedemptionRequest newRequest,
                       boolean newRequestPaid, BigInteger remainingLiquidity) {
        this.payouts = Collections.unmodifiableList(payouts);
        this.dequeuedCount = dequeuedCount;
        this.newRequest = newRequest;
        this.newRequestPaid = newRequestPaid;
        this.remainingLiquidity = remainingLiquidity;
    }

    public List<RedemptionRequest> getPayouts() {
        return payouts;
    }

    /**
     * 큐 head에서 제거된 요청 수
     */
    public int getDequeuedCount() {
        return dequeuedCount;
    }

    /**
     * 큐에서 제거된 요청들 (payouts 앞부분)
     */
    public List<RedemptionRequest> getDequeued() {
        return payouts.subList(0, dequeuedCount);
    }

    public boolean isNewRequestPaid() {
        return newRequestPaid;
    }

    /**
     * 신규 요청이 tail에 추가되었는지
     */
    public boolean isNewRequestQueued() {
        return newRequest != null && !newRequestPaid;
    }

    /**
     * available - sum(payouts)
     */
    public BigInteger getRemainingLiquidity() {
        return remainingLiquidity;
    }

    public BigInteger getTotalPaid() {
        BigInteger total = BigInteger.ZERO;
        for (RedemptionRequest payout : payouts) {
            total = total.add(payout.getAmount());
        }
        return total;
    }
}
