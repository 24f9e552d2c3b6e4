package dustin.backed.domains.issuance.engine;

/**
 * 큐 저장소 종류
 * Queue storage strategy
 *
 * - INDEXED: head/tail 인덱스 맵, 연산당 O(1) (기본값)
 * - COMPACTING: 배열 + 절반 초과 시 압축, 할당 용량 제한이 필요할 때 사용
 */
public enum QueueStorageType {
    INDEXED,
    COMPACTING;

    public RedemptionQueueStorage create() {
        switch (this) {
            case COMPACTING:
                return new CompactingQueueStorage();
            case INDEXED:
            default:
                return new IndexedQueueStorage();
        }
    }
}
