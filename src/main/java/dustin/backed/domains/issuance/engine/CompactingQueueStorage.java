// =====================================================
// CompactingQueueStorage - 배열 + 주기적 압축 저장소
// =====================================================
// 자료구조:
// ArrayList<RedemptionRequest> + headOffset
//   - entries[0..headOffset): 지급 완료 (null)
//   - entries[headOffset..size): 미지급
//   - baseIndex: entries[0]의 논리 인덱스
//
// 압축 규칙:
//   headOffset > entries.size() / 2 이면
//   → 앞쪽 지급 완료 구간을 잘라내고 (남은 엔트리를 앞으로 이동)
//   → trimToSize()로 내부 배열 축소
//
// 트레이드오프:
//   * 장점: 전체 할당 용량이 미지급 요청 수의 약 2배 이내로 제한됨
//   * 단점: 압축 시 O(n) 이동 비용 (상각하면 O(1))
//   * IndexedQueueStorage는 연산당 O(1)이지만 엔트리당 노드 오버헤드가 큼
// =====================================================

package dustin.backed.domains.issuance.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 압축 배열 기반 큐 저장소
 * Append-only array storage with periodic compaction
 */
public class CompactingQueueStorage implements RedemptionQueueStorage {

    private final ArrayList<RedemptionRequest> entries = new ArrayList<>();

    private int headOffset;

    private long baseIndex;

    @Override
    public long head() {
        return baseIndex + headOffset;
    }

    @Override
    public long tail() {
        return baseIndex + entries.size();
    }

    @Override
    public RedemptionRequest get(long index) {
        if (index < head() || index >= tail()) {
            throw new IndexOutOfBoundsException("Queue index " + index + " outside [" + head() + ", " + tail() + ")");
        }
        return entries.get((int) (index - baseIndex));
    }

    @Override
    public void append(RedemptionRequest request) {
        entries.add(request);
    }

    @Override
    public void removeHead(int count) {
        if (count < 0 || headOffset + count > entries.size()) {
            throw new IllegalArgumentException("Cannot remove " + count + " entries from queue of " + (tail() - head()));
        }
        for (int i = 0; i < count; i++) {
            entries.set(headOffset++, null);
        }
        if (headOffset > entries.size() / 2) {
            compact();
        }
    }

    @Override
    public void restoreHead(List<RedemptionRequest> requests) {
        int n = requests.size();
        if (headOffset < n) {
            // 압축으로 잘려나간 구간을 다시 확보
            int missing = n - headOffset;
            entries.addAll(0, Collections.nCopies(missing, null));
            baseIndex -= missing;
            headOffset += missing;
        }
        headOffset -= n;
        for (int i = 0; i < n; i++) {
            entries.set(headOffset + i, requests.get(i));
        }
    }

    @Override
    public void removeTail() {
        if (entries.size() == headOffset) {
            throw new IllegalStateException("Queue is empty");
        }
        entries.remove(entries.size() - 1);
    }

    @Override
    public int allocatedSlots() {
        return entries.size();
    }

    /**
     * 지급 완료 구간 제거 후 내부 배열 축소
     */
    private void compact() {
        entries.subList(0, headOffset).clear();
        entries.trimToSize();
        baseIndex += headOffset;
        headOffset = 0;
    }
}
