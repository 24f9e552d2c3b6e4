package dustin.backed.config;

import java.math.BigInteger;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import dustin.backed.domains.issuance.engine.QueueStorageType;
import lombok.Data;

/**
 * 발행자 설정
 * Issuer Configuration
 *
 * 역할:
 * - 계정(owner, operator, 수수료 수취, 보관, 브릿지) 초기값
 * - 가격/유동성 정책 초기값 (DB에 설정이 없을 때만 사용)
 * - 큐 저장소 종류, 자동 정산 여부, 스케줄러 주기
 * - 오라클/브릿지 연결 설정
 *
 * 설정 방법:
 * - application.yml에서 설정
 * - 환경변수로 오버라이드 가능 (예: ISSUER_OWNER)
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "issuer")
public class IssuerProperties {

    /**
     * 설정 권한자 (owner)
     */
    private String owner = "0x0000000000000000000000000000000000000001";

    /**
     * 자동화 운영자 (settle/drain/forward 트리거)
     */
    private String operator = "0x0000000000000000000000000000000000000002";

    /**
     * 수수료 수취 계정
     */
    private String feeCollector = "0x0000000000000000000000000000000000000003";

    /**
     * 발행자 준비자산 보관 계정 (로컬 버퍼)
     */
    private String custodyAccount = "0x00000000000000000000000000000000000000c0";

    /**
     * 준비자산 식별자
     */
    private String reserveAssetId = "USDT";

    private Pricing pricing = new Pricing();

    private Liquidity liquidity = new Liquidity();

    private Queue queue = new Queue();

    private Settlement settlement = new Settlement();

    private Oracle oracle = new Oracle();

    private Bridge bridge = new Bridge();

    /**
     * 가격 파라미터 초기값 (스프레드는 스케일 10^18)
     */
    @Data
    public static class Pricing {
        private BigInteger buySpread = BigInteger.ZERO;
        private BigInteger redeemSpread = BigInteger.ZERO;
        private BigInteger buyFee = BigInteger.ZERO;
        private BigInteger redeemFee = BigInteger.ZERO;
    }

    /**
     * 유동성 정책 초기값
     */
    @Data
    public static class Liquidity {
        private BigInteger bufferThreshold = BigInteger.ZERO;
        private BigInteger minBridgeAmount = BigInteger.ZERO;
    }

    @Data
    public static class Queue {
        /**
         * INDEXED (기본) 또는 COMPACTING
         */
        private QueueStorageType storage = QueueStorageType.INDEXED;

        /**
         * 한 번의 정산 호출에서 지급할 최대 큐 요청 수
         */
        private int maxBatch = 50;
    }

    @Data
    public static class Settlement {
        /**
         * 매수 후 큐 정산 + 초과분 전송을 자동 실행할지 여부
         */
        private boolean autoSettle = true;

        /**
         * 주기적 정산 스케줄러 사용 여부
         */
        private boolean schedulerEnabled = false;

        /**
         * 스케줄러 주기 (ms)
         */
        private long pollIntervalMs = 30000;
    }

    @Data
    public static class Oracle {
        /**
         * 사용할 오라클 빈 이름 (manualOracle, httpOracle)
         */
        private String name = "manualOracle";

        private Http http = new Http();

        @Data
        public static class Http {
            private String url;

            /**
             * 응답 JSON의 가격 필드명
             */
            private String priceField = "price";

            /**
             * 피드 가격의 소수 자릿수
             */
            private int decimals = 18;

            private int timeoutMs = 5000;
        }
    }

    @Data
    public static class Bridge {
        /**
         * 사용할 브릿지 빈 이름
         */
        private String name = "reserveBridge";

        /**
         * 브릿지 계정 (approve 대상)
         */
        private String account = "0x00000000000000000000000000000000000000b1";

        /**
         * 브릿지로 넘어간 준비자산이 모이는 금고 계정
         */
        private String vaultAccount = "0x00000000000000000000000000000000000000b2";

        /**
         * 정산 기록 Kafka 토픽
         */
        private String messageTopic = "bridge-settlement-records";

        private boolean kafkaEnabled = true;
    }
}
