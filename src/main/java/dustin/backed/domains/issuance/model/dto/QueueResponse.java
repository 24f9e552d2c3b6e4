package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상환 큐 상태 DTO
 * Redemption Queue Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "상환 큐 상태")
public class QueueResponse {

    @Schema(description = "다음 지급 대상 인덱스", example = "3")
    private long head;

    @Schema(description = "다음 추가 위치 인덱스", example = "5")
    private long tail;

    @Schema(description = "대기 중인 요청 수 (tail - head)", example = "2")
    private int length;

    @Schema(description = "대기 중인 요청 금액 합계", example = "70")
    private BigInteger pendingTotal;

    @Schema(description = "로컬 준비자산 잔고", example = "30")
    private BigInteger localBalance;

    @Schema(description = "head부터의 대기 요청 (최대 limit개)")
    private List<PayoutResponse> entries;
}
