package dustin.backed.domains.issuance.repository;

import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.backed.domains.issuance.model.entity.SettlementAuditLog;
import dustin.backed.domains.issuance.model.entity.SettlementAuditLog.AuditAction;

/**
 * 정산 감사 로그 리포지토리
 * Settlement Audit Log Repository
 */
@Repository
public interface SettlementAuditLogRepository extends JpaRepository<SettlementAuditLog, Long> {

    /**
     * 계정별 감사 로그 (최신순, 페이징)
     */
    Page<SettlementAuditLog> findByAccountOrderByIdDesc(String account, Pageable pageable);

    /**
     * 작업 유형별 감사 로그
     */
    List<SettlementAuditLog> findByActionOrderByIdAsc(AuditAction action);
}
