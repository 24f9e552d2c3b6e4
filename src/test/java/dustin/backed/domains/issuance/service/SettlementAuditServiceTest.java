package dustin.backed.domains.issuance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import dustin.backed.config.TestConfig;
import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.model.dto.AuditLogResponse;
import dustin.backed.domains.issuance.model.entity.SettlementAuditLog.AuditAction;
import dustin.backed.domains.issuance.repository.SettlementAuditLogRepository;
import dustin.backed.shared.model.dto.PageResponse;

/**
 * 정산 감사 로그 테스트
 *
 * 커밋된 작업만 기록되는지, 계정별 최신순 페이징 조회가 되는지 검증
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@Import(TestConfig.class)
class SettlementAuditServiceTest {

    private static final AccountId OWNER = AccountId.of("0x0000000000000000000000000000000000000001");
    private static final AccountId ALICE = AccountId.of("0x00000000000000000000000000000000000000a1");

    @Autowired
    private SettlementOrchestrator orchestrator;

    @Autowired
    private SettlementAuditService auditService;

    @Autowired
    private SettlementAuditLogRepository settlementAuditLogRepository;

    @Test
    @DisplayName("매수 → 상환 대기 → 입금 지급 순서로 감사 로그 기록 (최신순 조회)")
    void recordsSettlementLifecycle() {
        orchestrator.mintReserve(OWNER, ALICE, BigInteger.valueOf(25));
        orchestrator.approveReserve(ALICE, BigInteger.valueOf(25));
        orchestrator.buy(ALICE, BigInteger.valueOf(25));
        orchestrator.redeem(ALICE, BigInteger.valueOf(25));
        orchestrator.mintReserve(OWNER, OWNER, BigInteger.valueOf(25));
        orchestrator.approveReserve(OWNER, BigInteger.valueOf(25));
        orchestrator.depositBuffer(OWNER, BigInteger.valueOf(25));

        PageResponse<AuditLogResponse> page = auditService.findByAccount(ALICE, 0, 10);
        List<String> actions = page.getContent().stream()
                .map(AuditLogResponse::getAction)
                .collect(Collectors.toList());

        assertThat(actions).containsExactly("PAYOUT", "REDEEM", "REDEMPTION_QUEUED", "BUY");
        assertThat(page.getTotalElements()).isEqualTo(4);
        assertThat(page.getContent().get(3).getTokenAmount()).isEqualTo(BigInteger.valueOf(25));

        assertThat(settlementAuditLogRepository.findByActionOrderByIdAsc(AuditAction.FORWARD)).hasSize(1);
        assertThat(settlementAuditLogRepository.findByActionOrderByIdAsc(AuditAction.BUFFER_DEPOSIT)).hasSize(1);
    }

    @Test
    @DisplayName("페이지 크기 적용, 잘못된 페이지 요청 거부")
    void pagesAndValidatesRequest() {
        for (int i = 0; i < 3; i++) {
            auditService.record(AuditAction.BUY, ALICE, BigInteger.ONE, BigInteger.ONE, BigInteger.ONE, 0);
        }

        PageResponse<AuditLogResponse> first = auditService.findByAccount(ALICE, 0, 2);
        assertThat(first.getContent()).hasSize(2);
        assertThat(first.getTotalPages()).isEqualTo(2);
        assertThat(first.isLast()).isFalse();

        assertThatThrownBy(() -> auditService.findByAccount(ALICE, -1, 2)).isInstanceOf(IssuanceException.class);
        assertThatThrownBy(() -> auditService.findByAccount(ALICE, 0, 0)).isInstanceOf(IssuanceException.class);
    }
}
