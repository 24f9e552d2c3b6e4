package dustin.backed.domains.oracle;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.backed.config.IssuerProperties;
import dustin.backed.domains.issuance.exception.IssuanceException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP 가격 피드 오라클
 * HTTP Price Feed Oracle
 *
 * 역할:
 * - 외부 가격 피드(JSON)에서 가격 조회
 * - 피드 소수 자릿수(decimals)를 스케일 P(18자리)로 변환
 *
 * 응답 예시 (price-field=answer, decimals=8):
 * <pre>
 * { "answer": "30125000000", "updatedAt": 1735000000 }
 * → 301.25 → 301250000000000000000
 * </pre>
 *
 * 주의사항:
 * - 통신 실패/파싱 실패는 EXTERNAL_CALL_FAILURE
 * - 연결/읽기 타임아웃 적용 (issuer.oracle.http.timeout-ms)
 */
@Slf4j
@Component(HttpPriceOracle.NAME)
public class HttpPriceOracle implements PriceOracle {

    public static final String NAME = "httpOracle";

    private final IssuerProperties.Oracle.Http settings;

    private RestTemplate restTemplate;
    private ObjectMapper objectMapper;

    public HttpPriceOracle(IssuerProperties properties) {
        this.settings = properties.getOracle().getHttp();
    }

    /**
     * 서버 시작 시 HTTP 클라이언트 초기화
     * Initialize HTTP client on server startup
     */
    @PostConstruct
    public void init() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.getTimeoutMs());
        requestFactory.setReadTimeout(settings.getTimeoutMs());
        this.restTemplate = new RestTemplate(requestFactory);
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public BigInteger getPrice() {
        if (settings.getUrl() == null || settings.getUrl().isBlank()) {
            throw IssuanceException.externalCallFailure("HTTP oracle url is not configured", null);
        }
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(settings.getUrl(), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                log.error("[HttpPriceOracle] 가격 조회 실패: status={}", response.getStatusCode());
                throw IssuanceException.externalCallFailure("Price feed returned " + response.getStatusCode(), null);
            }
            return parsePrice(response.getBody());
        } catch (RestClientException e) {
            log.error("[HttpPriceOracle] 가격 피드 통신 실패: url={}, error={}", settings.getUrl(), e.getMessage());
            throw IssuanceException.externalCallFailure("Price feed unavailable: " + e.getMessage(), e);
        }
    }

    /**
     * 응답 본문에서 가격 필드를 읽어 스케일 P로 변환
     */
    BigInteger parsePrice(String body) {
        try {
            JsonNode node = objectMapper.readTree(body).path(settings.getPriceField());
            if (node.isMissingNode() || node.isNull()) {
                throw IssuanceException.externalCallFailure("Price field '" + settings.getPriceField() + "' missing", null);
            }
            BigDecimal raw = new BigDecimal(node.asText());
            return raw.movePointRight(18 - settings.getDecimals()).toBigInteger();
        } catch (com.fasterxml.jackson.core.JsonProcessingException | NumberFormatException e) {
            throw IssuanceException.externalCallFailure("Malformed price feed response: " + e.getMessage(), e);
        }
    }
}
