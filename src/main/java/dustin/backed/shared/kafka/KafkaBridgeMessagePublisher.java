package dustin.backed.shared.kafka;

import java.util.HexFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import dustin.backed.config.IssuerProperties;
import dustin.backed.domains.bridge.BridgeMessagePublisher;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 브릿지 메시지 발행자
 * Kafka Bridge Message Publisher
 *
 * 역할:
 * - 정산 기록(53바이트)을 16진수 문자열로 Kafka에 발행
 * - 키: 참여자 계정 (같은 계정의 기록은 같은 파티션 → 순서 유지)
 *
 * 주의사항:
 * - 발행은 비동기로 처리됨 (논블로킹)
 * - 실패해도 매수/상환에는 영향 없음 (로깅만)
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "issuer.bridge", name = "kafka-enabled", havingValue = "true", matchIfMissing = true)
public class KafkaBridgeMessagePublisher implements BridgeMessagePublisher {

    private static final HexFormat HEX = HexFormat.of();

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Executor bridgeMessageExecutor;
    private final String topic;

    public KafkaBridgeMessagePublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            @Qualifier("bridgeMessageExecutor") Executor bridgeMessageExecutor,
            IssuerProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.bridgeMessageExecutor = bridgeMessageExecutor;
        this.topic = properties.getBridge().getMessageTopic();
    }

    /**
     * 정산 기록 발행
     * Publish settlement record
     *
     * @param key 참여자 계정 (0x...)
     * @param encodedRecord 인코딩된 정산 기록
     */
    @Override
    public void publish(String key, byte[] encodedRecord) {
        String payload = "0x" + HEX.formatHex(encodedRecord);
        try {
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                kafkaTemplate.send(topic, key, payload);
                log.debug("[KafkaBridgeMessagePublisher] 정산 기록 발행: topic={}, key={}", topic, key);
            }, bridgeMessageExecutor);

            // 비동기 처리 (논블로킹)
            future.exceptionally(ex -> {
                log.error("[KafkaBridgeMessagePublisher] 정산 기록 발행 중 예외 발생: key={}, error={}",
                        key, ex.getMessage());
                return null;
            });

        } catch (Exception e) {
            log.error("[KafkaBridgeMessagePublisher] 정산 기록 발행 실패: key={}, error={}", key, e.getMessage());
        }
    }
}
