package dustin.backed.domains.issuance.engine;

import java.util.List;

/**
 * 상환 큐 저장소
 * Redemption Queue Storage
 *
 * 논리 인덱스 [head, tail) 구간이 미지급 요청입니다.
 * head 이전 인덱스는 논리적으로 삭제된 상태이며 조회할 수 없습니다.
 *
 * 구현체:
 * - {@link IndexedQueueStorage}: head/tail 인덱스 맵 (O(1), 기본값)
 * - {@link CompactingQueueStorage}: 배열 + 주기적 압축 (할당 용량 제한)
 */
public interface RedemptionQueueStorage {

    /**
     * 다음 미지급 요청의 논리 인덱스
     */
    long head();

    /**
     * 다음 추가 위치의 논리 인덱스
     */
    long tail();

    /**
     * @param index head &lt;= index &lt; tail
     * @throws IndexOutOfBoundsException 범위 밖 인덱스
     */
    RedemptionRequest get(long index);

    /**
     * tail에 추가
     */
    void append(RedemptionRequest request);

    /**
     * head부터 count개 삭제 (head += count)
     */
    void removeHead(int count);

    /**
     * 직전에 삭제한 요청들을 head 앞에 되돌림 (롤백용)
     *
     * @param requests 원래 순서대로의 요청 목록
     */
    void restoreHead(List<RedemptionRequest> requests);

    /**
     * 마지막으로 추가한 요청 제거 (롤백용)
     */
    void removeTail();

    /**
     * 현재 점유 중인 슬롯 수 (메모리 사용량 지표)
     */
    int allocatedSlots();
}
