package dustin.backed.shared.kafka;

import java.util.HexFormat;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import dustin.backed.domains.bridge.BridgeMessagePublisher;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 비활성화 시 사용하는 로깅 발행자
 * Logging-only publisher (issuer.bridge.kafka-enabled=false)
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "issuer.bridge", name = "kafka-enabled", havingValue = "false")
public class LoggingBridgeMessagePublisher implements BridgeMessagePublisher {

    @Override
    public void publish(String key, byte[] encodedRecord) {
        log.info("[LoggingBridgeMessagePublisher] 정산 기록 (Kafka 비활성화): key={}, record=0x{}",
                key, HexFormat.of().formatHex(encodedRecord));
    }
}
