package dustin.backed.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dustin.backed.domains.bridge.BridgeMessagePublisher;
import dustin.backed.domains.bridge.ReserveBridgeGateway;
import dustin.backed.domains.issuance.engine.LiquidityController;
import dustin.backed.domains.issuance.engine.PricingEngine;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.ledger.InMemoryReserveAsset;
import dustin.backed.domains.ledger.InMemorySyntheticTokenLedger;
import dustin.backed.domains.ledger.ReserveAsset;
import dustin.backed.domains.ledger.SyntheticTokenLedger;
import lombok.extern.slf4j.Slf4j;

/**
 * 발행자 구성요소 설정
 * Issuer Component Configuration
 *
 * 역할:
 * - 원장(준비자산, 합성 토큰), 가격 엔진, 유동성 컨트롤러 빈 등록
 * - 기본 브릿지 게이트웨이 등록 (빈 이름 = 설정의 bridge name)
 */
@Slf4j
@Configuration
public class IssuerComponentConfig {

    public static final String RESERVE_BRIDGE = "reserveBridge";

    @Bean
    public ReserveAsset reserveAsset(IssuerProperties properties) {
        log.info("[IssuerComponentConfig] 준비자산 원장 생성: assetId={}", properties.getReserveAssetId());
        return new InMemoryReserveAsset(properties.getReserveAssetId());
    }

    @Bean
    public SyntheticTokenLedger syntheticTokenLedger() {
        return new InMemorySyntheticTokenLedger();
    }

    @Bean
    public PricingEngine pricingEngine() {
        return new PricingEngine();
    }

    @Bean
    public LiquidityController liquidityController() {
        return new LiquidityController();
    }

    @Bean(name = RESERVE_BRIDGE)
    public ReserveBridgeGateway reserveBridge(ReserveAsset reserveAsset, IssuerProperties properties,
                                              BridgeMessagePublisher bridgeMessagePublisher) {
        IssuerProperties.Bridge bridge = properties.getBridge();
        log.info("[IssuerComponentConfig] 브릿지 게이트웨이 생성: account={}, vault={}, topic={}",
                bridge.getAccount(), bridge.getVaultAccount(), bridge.getMessageTopic());
        return new ReserveBridgeGateway(reserveAsset, AccountId.of(bridge.getAccount()),
                AccountId.of(bridge.getVaultAccount()), bridgeMessagePublisher);
    }
}
