package dustin.backed.domains.issuance.service;

import java.math.BigInteger;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.model.dto.AuditLogResponse;
import dustin.backed.domains.issuance.model.entity.SettlementAuditLog;
import dustin.backed.domains.issuance.model.entity.SettlementAuditLog.AuditAction;
import dustin.backed.domains.issuance.repository.SettlementAuditLogRepository;
import dustin.backed.shared.model.dto.PageResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 정산 감사 로그 서비스
 * Settlement Audit Service
 *
 * 역할:
 * - 커밋된 정산 작업을 감사 로그로 기록
 * - 계정별 감사 로그 페이징 조회
 *
 * 주의사항:
 * - 기록 실패는 정산을 되돌리지 않음 (이미 커밋된 작업)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementAuditService {

    private final SettlementAuditLogRepository settlementAuditLogRepository;

    public void record(AuditAction action, AccountId account, BigInteger reserveAmount,
                       BigInteger tokenAmount, BigInteger execPrice, int queueLength) {
        try {
            SettlementAuditLog auditLog = SettlementAuditLog.builder()
                    .action(action)
                    .account(account.toHex())
                    .reserveAmount(reserveAmount)
                    .tokenAmount(tokenAmount)
                    .execPrice(execPrice)
                    .queueLength(queueLength)
                    .build();

            settlementAuditLogRepository.save(auditLog);
        } catch (Exception e) {
            // 감사 로그 기록 실패는 정산 결과를 바꾸지 않음
            log.error("[SettlementAuditService] 감사 로그 기록 실패: action={}, account={}, reserveAmount={}",
                    action, account, reserveAmount, e);
        }
    }

    /**
     * 계정별 감사 로그 조회 (최신순)
     *
     * @param account 조회할 계정
     * @param page 페이지 번호 (0부터)
     * @param size 페이지 크기
     */
    @Transactional(readOnly = true)
    public PageResponse<AuditLogResponse> findByAccount(AccountId account, int page, int size) {
        if (page < 0 || size < 1) {
            throw IssuanceException.invalidInput("Invalid page request: page=" + page + ", size=" + size);
        }
        Page<SettlementAuditLog> logs = settlementAuditLogRepository.findByAccountOrderByIdDesc(
                account.toHex(), PageRequest.of(page, size));
        return PageResponse.of(logs, AuditLogResponse::from);
    }
}
