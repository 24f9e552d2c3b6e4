package dustin.backed.domains.issuance.scheduler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.dto.SettleResponse;
import dustin.backed.domains.issuance.service.IssuanceConfigService;
import dustin.backed.domains.issuance.service.SettlementOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 정산 스케줄러
 * Settlement Scheduler
 *
 * 역할:
 * - 주기적으로 operator 권한으로 settle 실행 (큐 정산 → 초과분 브릿지 전송)
 * - 자동 정산(issuer.settlement.auto-settle)을 끈 배포에서 정산 주기를 담당
 *
 * 실행 조건:
 * - issuer.settlement.scheduler-enabled=true 일 때만 등록
 * - 주기: issuer.settlement.poll-interval-ms (이전 실행 종료 기준)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "issuer.settlement", name = "scheduler-enabled", havingValue = "true")
public class SettlementScheduler {

    private final SettlementOrchestrator settlementOrchestrator;
    private final IssuanceConfigService issuanceConfigService;

    /**
     * 주기적 정산 (재시도 지원)
     * Periodic settle with retry
     *
     * 재시도 전략:
     * - 최대 3회, 지수 백오프 1초 → 2초
     * - IssuanceException (오라클/브릿지 실패 등) 발생 시 재시도
     * - 재시도 실패 시 recover 메서드 호출
     */
    @Scheduled(fixedDelayString = "${issuer.settlement.poll-interval-ms:30000}")
    @Retryable(
            retryFor = {IssuanceException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2)
    )
    public void settle() {
        if (settlementOrchestrator.queueLength() == 0
                && settlementOrchestrator.localBalance().signum() == 0) {
            log.debug("[SettlementScheduler] 정산 대상 없음");
            return;
        }

        SettleResponse result = settlementOrchestrator.settle(issuanceConfigService.snapshot().getOperator());
        log.info("[SettlementScheduler] 주기 정산 완료: payouts={}, forwarded={}, queueLength={}",
                result.getPayouts().size(), result.getForwardedAmount(), result.getQueueLength());
    }

    /**
     * 정산 재시도 실패 시 복구 처리
     * 다음 주기에 다시 시도되므로 상태 변경 없이 기록만 남깁니다.
     */
    @Recover
    public void recoverSettle(IssuanceException e) {
        log.error("[SettlementScheduler] 주기 정산 재시도 실패: code={}", e.getCode(), e);
    }
}
