package dustin.backed.domains.issuance.model.entity;

import java.math.BigInteger;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정산 감사 로그 엔티티
 * Settlement Audit Log Entity
 *
 * 역할:
 * - 커밋된 매수/상환/지급/전송/버퍼 작업을 모두 기록
 * - 누가, 언제, 얼마를 처리했는지 감사 추적
 *
 * 데이터 구조:
 * - action: 작업 유형 (AuditAction)
 * - account: 대상 계정 (매수자, 상환자, 지급 수혜자, 브릿지 금고 등)
 * - reserve_amount: 준비자산 금액 (순액)
 * - token_amount: 토큰 수량 (매수/상환만)
 * - exec_price: 체결 가격 (매수/상환만)
 * - queue_length: 작업 직후 상환 큐 길이
 */
@Entity
@Table(name = "settlement_audit_logs",
       indexes = {
           @Index(name = "idx_settlement_audit_logs_account", columnList = "account"),
           @Index(name = "idx_settlement_audit_logs_action", columnList = "action"),
           @Index(name = "idx_settlement_audit_logs_created_at", columnList = "created_at")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementAuditLog {

    /**
     * 감사 로그 작업 유형
     */
    public enum AuditAction {
        BUY,
        REDEEM,
        PAYOUT,
        REDEMPTION_QUEUED,
        FORWARD,
        BUFFER_DEPOSIT,
        BUFFER_WITHDRAW
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 30)
    private AuditAction action;

    @Column(name = "account", nullable = false, length = 42)
    private String account;

    @Column(name = "reserve_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger reserveAmount;

    @Column(name = "token_amount", precision = 78, scale = 0)
    private BigInteger tokenAmount;

    @Column(name = "exec_price", precision = 78, scale = 0)
    private BigInteger execPrice;

    @Column(name = "queue_length")
    private Integer queueLength;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
