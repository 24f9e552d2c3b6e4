// =====================================================
// RedemptionQueue - FIFO 상환 큐 (승인 제어)
// =====================================================
// 역할: 즉시 지급할 수 없는 상환 의무를 도착 순서대로 보관하고,
//       새 유동성이 들어올 때마다 정해진 배치 한도 내에서 지급
//
// 처리 알고리즘 (process):
// 1. head부터 순회: 처리 수 < maxBatch, 미지급 요청 존재,
//    다음 요청 금액 <= 남은 유동성 인 동안 지급 목록에 추가
// 2. 맞지 않는 첫 요청에서 정지 (뒤쪽의 작은 요청으로 건너뛰지 않음)
//    → head-of-line blocking은 의도된 정책
// 3. 신규 요청: 배치 한도가 남아 있고, 큐에 미지급 요청이 남지 않았고,
//    남은 유동성에 들어가면 즉시 지급, 아니면 tail에 추가
// 4. 지급된 큐 요청들을 head에서 제거
// 5. 지급 목록 반환 (큐 요청 먼저, 신규 요청 나중)
//
// 불변식:
// - 먼저 들어온 요청 A가 미지급이면 나중 요청 B는 절대 지급되지 않음
// - sum(payouts) <= available
// - 한 번의 호출에서 지급되는 요청 수 <= maxBatch
//
// 스레드 안전하지 않음: 호출자(SettlementOrchestrator)가 락으로 보호
// =====================================================

package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * FIFO 상환 큐
 * Redemption Queue
 *
 * 예시:
 * <pre>
 * RedemptionQueue queue = new RedemptionQueue(new IndexedQueueStorage());
 * queue.process(new RedemptionRequest(alice, 50), BigInteger.ZERO, 10); // 큐에 추가
 * queue.process(new RedemptionRequest(bob, 20), BigInteger.ZERO, 10);   // 큐에 추가
 * queue.process(BigInteger.valueOf(30), 10);  // 50이 막고 있으므로 아무것도 지급 안 됨
 * queue.process(BigInteger.valueOf(70), 10);  // alice 50, bob 20 순서대로 지급
 * </pre>
 */
public class RedemptionQueue {

    private final RedemptionQueueStorage storage;

    /**
     * 미지급 요청 금액 합계 (캐싱)
     */
    private BigInteger pendingTotal = BigInteger.ZERO;

    public RedemptionQueue(RedemptionQueueStorage storage) {
        this.storage = storage;
    }

    /**
     * 큐만 처리 (신규 요청 없음)
     *
     * @param available 현재 사용 가능한 유동성
     * @param maxBatch 한 번에 지급할 최대 요청 수 (1 이상)
     */
    public QueueProcessResult process(BigInteger available, int maxBatch) {
        return process(null, available, maxBatch);
    }

    /**
     * 큐 처리 + 신규 요청 승인 제어
     *
     * @param newRequest 신규 요청 (없으면 null)
     * @param available 현재 사용 가능한 유동성
     * @param maxBatch 한 번에 지급할 최대 요청 수 (1 이상)
     * @return 지급 목록과 처리 결과
     * @throws IssuanceException available이 uint256 범위 밖이거나 maxBatch &lt; 1
     */
    public QueueProcessResult process(RedemptionRequest newRequest, BigInteger available, int maxBatch) {
        FixedPoint.requireUint256(available, "available liquidity");
        if (maxBatch < 1) {
            throw IssuanceException.invalidInput("maxBatch must be at least 1: " + maxBatch);
        }

        List<RedemptionRequest> payouts = new ArrayList<>();
        BigInteger remaining = available;
        long cursor = storage.head();
        long tail = storage.tail();
        int processed = 0;

        // 1~2. head부터 FIFO 순서로 지급, 맞지 않는 첫 요청에서 정지
        while (processed < maxBatch && cursor < tail) {
            RedemptionRequest queued = storage.get(cursor);
            if (queued.getAmount().compareTo(remaining) > 0) {
                break;
            }
            remaining = remaining.subtract(queued.getAmount());
            payouts.add(queued);
            cursor++;
            processed++;
        }

        // 3. 신규 요청 승인 제어
        boolean newRequestPaid = false;
        if (newRequest != null) {
            boolean queueCleared = cursor == tail;
            if (processed < maxBatch && queueCleared && newRequest.getAmount().compareTo(remaining) <= 0) {
                remaining = remaining.subtract(newRequest.getAmount());
                payouts.add(newRequest);
                newRequestPaid = true;
            } else {
                storage.append(newRequest);
                pendingTotal = pendingTotal.add(newRequest.getAmount());
            }
        }

        // 4. 지급된 큐 요청 제거
        storage.removeHead(processed);
        for (int i = 0; i < processed; i++) {
            pendingTotal = pendingTotal.subtract(payouts.get(i).getAmount());
        }

        return new QueueProcessResult(payouts, processed, newRequest, newRequestPaid, remaining);
    }

    /**
     * process 호출 1회를 되돌림
     *
     * 지급 이체가 실패했을 때 큐를 호출 이전 상태로 복원합니다.
     * 가장 최근의 process 결과에 대해서만 호출해야 합니다.
     *
     * @param result 되돌릴 처리 결과
     */
    public void revert(QueueProcessResult result) {
        if (result.isNewRequestQueued()) {
            RedemptionRequest last = storage.get(storage.tail() - 1);
            storage.removeTail();
            pendingTotal = pendingTotal.subtract(last.getAmount());
        }
        List<RedemptionRequest> dequeued = result.getDequeued();
        if (!dequeued.isEmpty()) {
            storage.restoreHead(dequeued);
            for (RedemptionRequest request : dequeued) {
                pendingTotal = pendingTotal.add(request.getAmount());
            }
        }
    }

    /**
     * 미지급 요청 수 (tail - head)
     */
    public int length() {
        return (int) (storage.tail() - storage.head());
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public long head() {
        return storage.head();
    }

    public long tail() {
        return storage.tail();
    }

    /**
     * head + offset 위치의 요청 조회
     */
    public RedemptionRequest peek(int offset) {
        return storage.get(storage.head() + offset);
    }

    public BigInteger pendingTotal() {
        return pendingTotal;
    }

    /**
     * 앞에서부터 최대 limit개의 미지급 요청
     */
    public List<RedemptionRequest> snapshot(int limit) {
        int count = Math.min(limit, length());
        List<RedemptionRequest> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(peek(i));
        }
        return result;
    }

    public int allocatedSlots() {
        return storage.allocatedSlots();
    }
}
