package dustin.backed.domains.issuance.service;

import java.util.Map;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Service;

import dustin.backed.config.IssuerProperties;
import dustin.backed.domains.bridge.BridgeGateway;
import dustin.backed.domains.issuance.engine.LiquidityPolicy;
import dustin.backed.domains.issuance.engine.PricingParameters;
import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.model.entity.IssuanceConfig;
import dustin.backed.domains.issuance.repository.IssuanceConfigRepository;
import dustin.backed.domains.oracle.PriceOracle;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * 발행 설정 서비스 (설정 권한자)
 * Issuance Config Service
 *
 * 역할:
 * - 서버 시작 시 DB의 발행 설정을 메모리 스냅샷으로 로드 (없으면 application.yml 값으로 생성)
 * - owner 권한 확인 후 설정 변경 → DB 저장 → 스냅샷 교체
 * - 이름으로 오라클/브릿지 빈 조회
 *
 * 동시성:
 * - 스냅샷은 불변 객체, volatile 참조 교체로 원자적 갱신
 * - 정산 호출은 락 없이 스냅샷을 읽음 (호출 하나는 스냅샷 하나만 사용)
 * - 설정 변경끼리는 synchronized로 직렬화 (DB 저장과 스냅샷 교체 순서 보장)
 */
@Slf4j
@Service
public class IssuanceConfigService {

    private final IssuanceConfigRepository issuanceConfigRepository;
    private final IssuerProperties properties;
    private final Map<String, PriceOracle> oracles;
    private final Map<String, BridgeGateway> bridges;

    private volatile IssuanceSettings settings;

    public IssuanceConfigService(
            IssuanceConfigRepository issuanceConfigRepository,
            IssuerProperties properties,
            Map<String, PriceOracle> oracles,
            Map<String, BridgeGateway> bridges) {
        this.issuanceConfigRepository = issuanceConfigRepository;
        this.properties = properties;
        this.oracles = oracles;
        this.bridges = bridges;
    }

    /**
     * 서버 시작 시 발행 설정 로드
     * Load issuance config on server startup
     */
    @PostConstruct
    public synchronized void loadConfig() {
        log.info("[IssuanceConfigService] 발행 설정 로드 시작");

        IssuanceConfig config = issuanceConfigRepository.findById(IssuanceConfig.SINGLETON_ID)
                .orElseGet(() -> {
                    log.warn("[IssuanceConfigService] 저장된 발행 설정이 없습니다. application 설정값으로 초기화합니다");
                    return issuanceConfigRepository.save(defaultConfig());
                });

        this.settings = toSettings(config);
        log.info("[IssuanceConfigService] 발행 설정 로드 완료: {}", settings);
    }

    /**
     * 현재 설정 스냅샷
     */
    public IssuanceSettings snapshot() {
        return settings;
    }

    public PriceOracle resolveOracle(IssuanceSettings snapshot) {
        PriceOracle oracle = oracles.get(snapshot.getOracleName());
        if (oracle == null) {
            throw IssuanceException.externalCallFailure("Oracle not registered: " + snapshot.getOracleName(), null);
        }
        return oracle;
    }

    public BridgeGateway resolveBridge(IssuanceSettings snapshot) {
        BridgeGateway bridge = bridges.get(snapshot.getBridgeName());
        if (bridge == null) {
            throw IssuanceException.externalCallFailure("Bridge not registered: " + snapshot.getBridgeName(), null);
        }
        return bridge;
    }

    // ============================================
    // 설정 변경 (owner 전용)
    // ============================================

    public IssuanceSettings updatePricing(AccountId caller, PricingParameters pricing) {
        return apply(caller, "pricing", builder -> builder.pricing(pricing));
    }

    public IssuanceSettings updateLiquidityPolicy(AccountId caller, LiquidityPolicy policy) {
        return apply(caller, "liquidityPolicy", builder -> builder.liquidityPolicy(policy));
    }

    public IssuanceSettings updateMaxBatch(AccountId caller, int maxBatch) {
        if (maxBatch < 1) {
            throw IssuanceException.invalidInput("maxBatch must be at least 1: " + maxBatch);
        }
        return apply(caller, "maxBatch", builder -> builder.maxBatch(maxBatch));
    }

    public IssuanceSettings updateOracle(AccountId caller, String oracleName) {
        if (oracleName == null || !oracles.containsKey(oracleName)) {
            throw IssuanceException.invalidInput("Unknown oracle: " + oracleName + " (available: " + oracles.keySet() + ")");
        }
        return apply(caller, "oracle", builder -> builder.oracleName(oracleName));
    }

    public IssuanceSettings updateBridge(AccountId caller, String bridgeName) {
        if (bridgeName == null || !bridges.containsKey(bridgeName)) {
            throw IssuanceException.invalidInput("Unknown bridge: " + bridgeName + " (available: " + bridges.keySet() + ")");
        }
        return apply(caller, "bridge", builder -> builder.bridgeName(bridgeName));
    }

    public IssuanceSettings updateFeeCollector(AccountId caller, AccountId feeCollector) {
        requireNonZero(feeCollector, "feeCollector");
        return apply(caller, "feeCollector", builder -> builder.feeCollector(feeCollector));
    }

    public IssuanceSettings updateOperator(AccountId caller, AccountId operator) {
        requireNonZero(operator, "operator");
        return apply(caller, "operator", builder -> builder.operator(operator));
    }

    public IssuanceSettings transferOwnership(AccountId caller, AccountId newOwner) {
        requireNonZero(newOwner, "owner");
        return apply(caller, "owner", builder -> builder.owner(newOwner));
    }

    // ============================================
    // 권한 확인
    // ============================================

    public void requireOwner(AccountId caller, IssuanceSettings snapshot) {
        if (caller == null || !snapshot.isOwner(caller)) {
            throw IssuanceException.unauthorized("Caller is not the owner: " + caller);
        }
    }

    public void requireOwnerOrOperator(AccountId caller, IssuanceSettings snapshot) {
        if (caller == null || !snapshot.isOwnerOrOperator(caller)) {
            throw IssuanceException.unauthorized("Caller is neither owner nor operator: " + caller);
        }
    }

    /**
     * 권한 확인 → DB 저장 → 스냅샷 교체
     */
    private synchronized IssuanceSettings apply(
            AccountId caller, String field, UnaryOperator<IssuanceSettings.IssuanceSettingsBuilder> change) {
        requireOwner(caller, settings);
        IssuanceSettings updated = change.apply(settings.toBuilder()).build();
        issuanceConfigRepository.save(toEntity(updated));
        this.settings = updated;
        log.info("[IssuanceConfigService] 설정 변경: field={}, by={}, settings={}", field, caller, updated);
        return updated;
    }

    private static void requireNonZero(AccountId account, String name) {
        if (account == null || account.isZero()) {
            throw IssuanceException.invalidInput(name + " must be a non-zero account");
        }
    }

    private IssuanceConfig defaultConfig() {
        IssuerProperties.Pricing pricing = properties.getPricing();
        IssuerProperties.Liquidity liquidity = properties.getLiquidity();
        return IssuanceConfig.builder()
                .id(IssuanceConfig.SINGLETON_ID)
                .buySpread(pricing.getBuySpread())
                .redeemSpread(pricing.getRedeemSpread())
                .buyFee(pricing.getBuyFee())
                .redeemFee(pricing.getRedeemFee())
                .bufferThreshold(liquidity.getBufferThreshold())
                .minBridgeAmount(liquidity.getMinBridgeAmount())
                .maxBatch(properties.getQueue().getMaxBatch())
                .oracleName(properties.getOracle().getName())
                .bridgeName(properties.getBridge().getName())
                .feeCollector(AccountId.of(properties.getFeeCollector()).toHex())
                .operatorAccount(AccountId.of(properties.getOperator()).toHex())
                .ownerAccount(AccountId.of(properties.getOwner()).toHex())
                .build();
    }

    private static IssuanceSettings toSettings(IssuanceConfig config) {
        return IssuanceSettings.builder()
                .pricing(new PricingParameters(config.getBuySpread(), config.getRedeemSpread(),
                        config.getBuyFee(), config.getRedeemFee()))
                .liquidityPolicy(new LiquidityPolicy(config.getBufferThreshold(), config.getMinBridgeAmount()))
                .maxBatch(config.getMaxBatch())
                .oracleName(config.getOracleName())
                .bridgeName(config.getBridgeName())
                .feeCollector(AccountId.of(config.getFeeCollector()))
                .operator(AccountId.of(config.getOperatorAccount()))
                .owner(AccountId.of(config.getOwnerAccount()))
                .build();
    }

    private IssuanceConfig toEntity(IssuanceSettings snapshot) {
        IssuanceConfig config = issuanceConfigRepository.findById(IssuanceConfig.SINGLETON_ID)
                .orElseGet(() -> IssuanceConfig.builder().id(IssuanceConfig.SINGLETON_ID).build());
        config.setBuySpread(snapshot.getPricing().getBuySpread());
        config.setRedeemSpread(snapshot.getPricing().getRedeemSpread());
        config.setBuyFee(snapshot.getPricing().getBuyFee());
        config.setRedeemFee(snapshot.getPricing().getRedeemFee());
        config.setBufferThreshold(snapshot.getLiquidityPolicy().getBufferThreshold());
        config.setMinBridgeAmount(snapshot.getLiquidityPolicy().getMinBridgeAmount());
        config.setMaxBatch(snapshot.getMaxBatch());
        config.setOracleName(snapshot.getOracleName());
        config.setBridgeName(snapshot.getBridgeName());
        config.setFeeCollector(snapshot.getFeeCollector().toHex());
        config.setOperatorAccount(snapshot.getOperator().toHex());
        config.setOwnerAccount(snapshot.getOwner().toHex());
        return config;
    }
}
