package dustin.backed.domains.issuance.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import dustin.backed.config.TestConfig;
import dustin.backed.domains.issuance.engine.LiquidityPolicy;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.service.IssuanceConfigService;
import dustin.backed.domains.issuance.service.SettlementOrchestrator;

/**
 * 주기 정산 스케줄러 테스트
 *
 * 주기 실행은 한 시간 간격으로 두고 settle()을 직접 호출합니다.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
    "issuer.settlement.scheduler-enabled=true",
    "issuer.settlement.poll-interval-ms=3600000"
})
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@Import(TestConfig.class)
class SettlementSchedulerTest {

    private static final AccountId OWNER = AccountId.of("0x0000000000000000000000000000000000000001");
    private static final AccountId ALICE = AccountId.of("0x00000000000000000000000000000000000000a1");

    @Autowired
    private SettlementScheduler scheduler;

    @Autowired
    private SettlementOrchestrator orchestrator;

    @Autowired
    private IssuanceConfigService configService;

    private void buyAndHold(long amount) {
        configService.updateLiquidityPolicy(OWNER, new LiquidityPolicy(BigInteger.valueOf(1000), BigInteger.ZERO));
        orchestrator.mintReserve(OWNER, ALICE, BigInteger.valueOf(amount));
        orchestrator.approveReserve(ALICE, BigInteger.valueOf(amount));
        orchestrator.buy(ALICE, BigInteger.valueOf(amount));
    }

    @Test
    @DisplayName("정산 대상이 없으면 아무것도 하지 않음")
    void skipsWhenNothingToSettle() {
        assertThatCode(() -> scheduler.settle()).doesNotThrowAnyException();
        assertThat(orchestrator.localBalance()).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("threshold를 낮추면 다음 주기에 초과분 전송")
    void forwardsExcessOnTick() {
        buyAndHold(100);
        configService.updateLiquidityPolicy(OWNER, new LiquidityPolicy(BigInteger.valueOf(30), BigInteger.ZERO));

        scheduler.settle();

        assertThat(orchestrator.localBalance()).isEqualTo(BigInteger.valueOf(30));
    }

    @Test
    @DisplayName("브릿지 실패는 재시도 후 복구 처리, 잔고는 그대로")
    void recoversAfterRetries() {
        buyAndHold(100);
        configService.updateBridge(OWNER, TestConfig.FAILING_BRIDGE);
        configService.updateLiquidityPolicy(OWNER, LiquidityPolicy.ZERO);

        assertThatCode(() -> scheduler.settle()).doesNotThrowAnyException();
        assertThat(orchestrator.localBalance()).isEqualTo(BigInteger.valueOf(100));
    }
}
