package dustin.backed.domains.issuance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import dustin.backed.config.TestConfig;
import dustin.backed.domains.issuance.engine.LiquidityPolicy;
import dustin.backed.domains.issuance.engine.PricingParameters;
import dustin.backed.domains.issuance.exception.IssuanceErrorCode;
import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.model.entity.IssuanceConfig;
import dustin.backed.domains.issuance.repository.IssuanceConfigRepository;
import dustin.backed.domains.oracle.HttpPriceOracle;

/**
 * 발행 설정 서비스 테스트
 *
 * 목적:
 * - 기동 시 application 설정값으로 단일 설정 행 생성
 * - owner만 변경 가능, 변경은 DB와 스냅샷에 함께 반영
 * - 이전 스냅샷은 변경되지 않음 (진행 중인 정산은 처음 읽은 값 사용)
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@Import(TestConfig.class)
class IssuanceConfigServiceTest {

    private static final AccountId OWNER = AccountId.of("0x0000000000000000000000000000000000000001");
    private static final AccountId OPERATOR = AccountId.of("0x0000000000000000000000000000000000000002");
    private static final AccountId NEW_OWNER = AccountId.of("0x00000000000000000000000000000000000000d1");

    @Autowired
    private IssuanceConfigService configService;

    @Autowired
    private IssuanceConfigRepository issuanceConfigRepository;

    private static IssuanceErrorCode codeOf(Throwable e) {
        return ((IssuanceException) e).getCode();
    }

    @Test
    @DisplayName("기동 시 기본 설정 행 생성")
    void createsDefaultConfigOnStartup() {
        IssuanceConfig stored = issuanceConfigRepository.findById(IssuanceConfig.SINGLETON_ID).orElseThrow();
        IssuanceSettings settings = configService.snapshot();

        assertThat(stored.getOwnerAccount()).isEqualTo(OWNER.toHex());
        assertThat(stored.getMaxBatch()).isEqualTo(50);
        assertThat(settings.getOracleName()).isEqualTo("manualOracle");
        assertThat(settings.getBridgeName()).isEqualTo("reserveBridge");
        assertThat(settings.getLiquidityPolicy()).isEqualTo(LiquidityPolicy.ZERO);
    }

    @Test
    @DisplayName("가격 설정 변경은 DB에 저장되고 재로드 후에도 유지")
    void pricingUpdatePersists() {
        PricingParameters pricing = new PricingParameters(
                BigInteger.valueOf(5), BigInteger.valueOf(7), BigInteger.ONE, BigInteger.TWO);

        configService.updatePricing(OWNER, pricing);
        configService.loadConfig();

        IssuanceConfig stored = issuanceConfigRepository.findById(IssuanceConfig.SINGLETON_ID).orElseThrow();
        assertThat(stored.getBuySpread()).isEqualTo(BigInteger.valueOf(5));
        assertThat(stored.getRedeemFee()).isEqualTo(BigInteger.TWO);
        assertThat(configService.snapshot().getPricing()).isEqualTo(pricing);
    }

    @Test
    @DisplayName("변경은 새 스냅샷으로 교체, 이전 스냅샷은 그대로")
    void previousSnapshotIsUnchanged() {
        IssuanceSettings before = configService.snapshot();

        configService.updateLiquidityPolicy(OWNER, new LiquidityPolicy(BigInteger.TEN, BigInteger.ONE));

        assertThat(before.getLiquidityPolicy()).isEqualTo(LiquidityPolicy.ZERO);
        assertThat(configService.snapshot().getLiquidityPolicy().getBufferThreshold()).isEqualTo(BigInteger.TEN);
    }

    @Test
    @DisplayName("operator는 설정 변경 불가")
    void operatorCannotChangeConfig() {
        assertThatThrownBy(() -> configService.updateMaxBatch(OPERATOR, 10))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(IssuanceErrorCode.UNAUTHORIZED));
        assertThat(configService.snapshot().getMaxBatch()).isEqualTo(50);
    }

    @Test
    @DisplayName("소유권 이전 후 이전 owner는 권한 상실")
    void ownershipTransfer() {
        configService.transferOwnership(OWNER, NEW_OWNER);

        assertThatThrownBy(() -> configService.updateMaxBatch(OWNER, 10))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(IssuanceErrorCode.UNAUTHORIZED));

        configService.updateMaxBatch(NEW_OWNER, 10);
        assertThat(configService.snapshot().getMaxBatch()).isEqualTo(10);
        assertThat(issuanceConfigRepository.findById(IssuanceConfig.SINGLETON_ID).orElseThrow().getOwnerAccount())
                .isEqualTo(NEW_OWNER.toHex());
    }

    @Test
    @DisplayName("등록된 오라클/브릿지 이름으로만 교체 가능")
    void switchesOracleAndBridgeByName() {
        configService.updateOracle(OWNER, HttpPriceOracle.NAME);
        configService.updateBridge(OWNER, TestConfig.FAILING_BRIDGE);

        assertThat(configService.resolveOracle(configService.snapshot())).isInstanceOf(HttpPriceOracle.class);
        assertThat(configService.resolveBridge(configService.snapshot()).account())
                .isEqualTo(TestConfig.FAILING_BRIDGE_ACCOUNT);

        assertThatThrownBy(() -> configService.updateOracle(OWNER, "chainlink"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(IssuanceErrorCode.INVALID_INPUT));
        assertThatThrownBy(() -> configService.updateBridge(OWNER, null))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(IssuanceErrorCode.INVALID_INPUT));
    }

    @Test
    @DisplayName("잘못된 값은 INVALID_INPUT (maxBatch 0, 0 주소)")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> configService.updateMaxBatch(OWNER, 0))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(IssuanceErrorCode.INVALID_INPUT));
        assertThatThrownBy(() -> configService.updateOperator(OWNER, AccountId.ZERO))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(IssuanceErrorCode.INVALID_INPUT));
        assertThatThrownBy(() -> configService.transferOwnership(OWNER, AccountId.ZERO))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(IssuanceErrorCode.INVALID_INPUT));
    }
}
