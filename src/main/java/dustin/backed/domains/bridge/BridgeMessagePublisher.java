package dustin.backed.domains.bridge;

/**
 * 브릿지 메시지 발행자
 * Bridge message publisher
 *
 * 발행 실패는 호출자에게 전파하지 않습니다 (전달 보장은 브릿지 책임).
 */
public interface BridgeMessagePublisher {

    /**
     * @param key 파티션 키 (참여자 계정)
     * @param encodedRecord 인코딩된 정산 기록
     */
    void publish(String key, byte[] encodedRecord);
}
