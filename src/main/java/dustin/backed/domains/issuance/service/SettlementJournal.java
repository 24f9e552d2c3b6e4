package dustin.backed.domains.issuance.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * 정산 호출 1회의 보상 작업 저널
 * Settlement Journal
 *
 * 역할:
 * - 외부 원장에 가한 변경마다 되돌리는 보상 작업을 기록
 * - 실패 시 기록의 역순으로 보상 실행 (보상 트랜잭션)
 * - 커밋 후에만 실행할 작업 (브릿지 메시지, 감사 로그) 보관
 *
 * 주의사항:
 * - 호출 1회 전용, 재사용 금지
 * - 오케스트레이터 락 안에서만 사용 (스레드 안전하지 않음)
 */
@Slf4j
final class SettlementJournal {

    private final String operation;
    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private final List<Runnable> afterCommit = new ArrayList<>();

    SettlementJournal(String operation) {
        this.operation = operation;
    }

    /**
     * 보상 작업 기록 (이미 적용된 변경을 되돌리는 작업)
     */
    void record(String description, Runnable undo) {
        compensations.push(new Compensation(description, undo));
    }

    /**
     * 커밋 후 실행할 작업 등록
     */
    void afterCommit(Runnable action) {
        afterCommit.add(action);
    }

    /**
     * 보상 작업을 역순으로 실행
     *
     * 보상 하나가 실패해도 나머지는 계속 실행하고, 실패는 원인 예외에 suppressed로 붙입니다.
     *
     * @param cause 롤백을 일으킨 예외
     */
    void rollback(RuntimeException cause) {
        log.warn("[SettlementJournal] 롤백 시작: operation={}, steps={}, cause={}",
                operation, compensations.size(), cause.getMessage());

        while (!compensations.isEmpty()) {
            Compensation compensation = compensations.pop();
            try {
                compensation.undo.run();
                log.debug("[SettlementJournal] 보상 완료: operation={}, step={}", operation, compensation.description);
            } catch (RuntimeException e) {
                log.error("[SettlementJournal] 보상 실패: operation={}, step={}",
                        operation, compensation.description, e);
                cause.addSuppressed(e);
            }
        }
        afterCommit.clear();
    }

    /**
     * 커밋: 보상 기록을 버리고 커밋 후 작업 실행
     *
     * 커밋 후 작업의 실패는 이미 확정된 결과를 바꾸지 않으므로 로그만 남깁니다.
     */
    void commit() {
        compensations.clear();
        for (Runnable action : afterCommit) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("[SettlementJournal] 커밋 후 작업 실패: operation={}", operation, e);
            }
        }
        afterCommit.clear();
    }

    private static final class Compensation {
        private final String description;
        private final Runnable undo;

        private Compensation(String description, Runnable undo) {
            this.description = description;
            this.undo = undo;
        }
    }
}
