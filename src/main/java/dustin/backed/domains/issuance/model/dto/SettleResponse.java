package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정산 응답 DTO
 * Settle Response DTO
 *
 * 큐 정산, 브릿지 전송, 버퍼 입출금 호출의 공통 결과입니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "정산 결과")
public class SettleResponse {

    @Schema(description = "지급된 상환 요청 (FIFO 순서)")
    private List<PayoutResponse> payouts;

    @Schema(description = "브릿지로 전송된 금액", example = "0")
    private BigInteger forwardedAmount;

    @Schema(description = "호출 후 로컬 준비자산 잔고", example = "50")
    private BigInteger localBalance;

    @Schema(description = "호출 후 상환 큐 길이", example = "0")
    private int queueLength;
}
