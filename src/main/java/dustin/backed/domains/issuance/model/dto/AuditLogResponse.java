package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;
import java.time.LocalDateTime;

import dustin.backed.domains.issuance.model.entity.SettlementAuditLog;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 감사 로그 응답 DTO
 * Audit Log Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "정산 감사 로그")
public class AuditLogResponse {

    @Schema(description = "감사 로그 ID", example = "1")
    private Long id;

    @Schema(description = "작업 유형", example = "BUY")
    private String action;

    @Schema(description = "대상 계정", example = "0x00000000000000000000000000000000000000aa")
    private String account;

    @Schema(description = "준비자산 금액 (순액)", example = "99")
    private BigInteger reserveAmount;

    @Schema(description = "토큰 수량 (매수/상환만)", example = "99")
    private BigInteger tokenAmount;

    @Schema(description = "체결 가격 (10^18 스케일)", example = "1000000000000000000")
    private BigInteger execPrice;

    @Schema(description = "작업 직후 상환 큐 길이", example = "0")
    private Integer queueLength;

    @Schema(description = "기록 시각")
    private LocalDateTime createdAt;

    public static AuditLogResponse from(SettlementAuditLog auditLog) {
        return AuditLogResponse.builder()
                .id(auditLog.getId())
                .action(auditLog.getAction().name())
                .account(auditLog.getAccount())
                .reserveAmount(auditLog.getReserveAmount())
                .tokenAmount(auditLog.getTokenAmount())
                .execPrice(auditLog.getExecPrice())
                .queueLength(auditLog.getQueueLength())
                .createdAt(auditLog.getCreatedAt())
                .build();
    }
}
