// =====================================================
// IndexedQueueStorage - head/tail 인덱스 맵 저장소
// =====================================================
// 자료구조:
// HashMap<Long, RedemptionRequest>
//   - Key: 논리 인덱스 (head부터 tail-1까지)
//   * 조회/추가/삭제: O(1) average
//   * 장점: 압축 불필요, 연산당 O(1)
//   * 단점: 엔트리당 박싱된 Long 키 + 노드 오버헤드
//
// 지급된 슬롯은 즉시 삭제되고 재사용되지 않음
// → 활성 저장 공간은 항상 tail - head
// =====================================================

package dustin.backed.domains.issuance.engine;

import java.util.HashMap;
import java.util.List;

/**
 * 인덱스 맵 기반 큐 저장소
 * Head/tail indexed associative storage
 */
public class IndexedQueueStorage implements RedemptionQueueStorage {

    private final HashMap<Long, RedemptionRequest> slots = new HashMap<>();

    private long head;
    private long tail;

    @Override
    public long head() {
        return head;
    }

    @Override
    public long tail() {
        return tail;
    }

    @Override
    public RedemptionRequest get(long index) {
        if (index < head || index >= tail) {
            throw new IndexOutOfBoundsException("Queue index " + index + " outside [" + head + ", " + tail + ")");
        }
        return slots.get(index);
    }

    @Override
    public void append(RedemptionRequest request) {
        slots.put(tail, request);
        tail++;
    }

    @Override
    public void removeHead(int count) {
        if (count < 0 || head + count > tail) {
            throw new IllegalArgumentException("Cannot remove " + count + " entries from queue of " + (tail - head));
        }
        for (int i = 0; i < count; i++) {
            slots.remove(head);
            head++;
        }
    }

    @Override
    public void restoreHead(List<RedemptionRequest> requests) {
        head -= requests.size();
        long index = head;
        for (RedemptionRequest request : requests) {
            slots.put(index++, request);
        }
    }

    @Override
    public void removeTail() {
        if (tail == head) {
            throw new IllegalStateException("Queue is empty");
        }
        tail--;
        slots.remove(tail);
    }

    @Override
    public int allocatedSlots() {
        return slots.size();
    }
}
