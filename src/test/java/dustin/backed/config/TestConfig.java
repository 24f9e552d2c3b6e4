package dustin.backed.config;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import dustin.backed.domains.bridge.BridgeGateway;
import dustin.backed.domains.bridge.BridgeMessagePublisher;
import dustin.backed.domains.issuance.model.AccountId;

/**
 * 테스트용 설정 클래스
 * Test Configuration
 *
 * 역할:
 * - 발행된 정산 기록을 메모리에 모으는 발행자 (Kafka 대신)
 * - 항상 전송에 실패하는 브릿지 ("failingBridge")
 */
@TestConfiguration
public class TestConfig {

    public static final String FAILING_BRIDGE = "failingBridge";

    public static final AccountId FAILING_BRIDGE_ACCOUNT = AccountId.of("0x00000000000000000000000000000000000000f1");

    @Bean
    @Primary
    public RecordingBridgeMessagePublisher recordingBridgeMessagePublisher() {
        return new RecordingBridgeMessagePublisher();
    }

    @Bean(name = FAILING_BRIDGE)
    public FailingBridgeGateway failingBridge() {
        return new FailingBridgeGateway();
    }

    public static class RecordingBridgeMessagePublisher implements BridgeMessagePublisher {

        private final List<byte[]> records = new CopyOnWriteArrayList<>();

        @Override
        public void publish(String key, byte[] encodedRecord) {
            records.add(encodedRecord);
        }

        public List<byte[]> records() {
            return records;
        }
    }

    public static class FailingBridgeGateway implements BridgeGateway {

        private final List<byte[]> messages = new CopyOnWriteArrayList<>();

        @Override
        public AccountId account() {
            return FAILING_BRIDGE_ACCOUNT;
        }

        @Override
        public void sendStable(AccountId sender, String assetId, BigInteger amount) {
            throw new IllegalStateException("bridge endpoint unreachable");
        }

        @Override
        public void sendMessage(byte[] encodedRecord) {
            messages.add(encodedRecord);
        }

        public List<byte[]> messages() {
            return messages;
        }
    }
}
