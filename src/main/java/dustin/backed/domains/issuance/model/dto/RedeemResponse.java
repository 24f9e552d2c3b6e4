package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상환 응답 DTO
 * Redeem Response DTO
 *
 * status:
 * - PAID: 유동성이 충분해 즉시 지급
 * - QUEUED: 상환 큐 끝에 추가됨 (유동성 보충 시 순서대로 지급)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "상환 결과")
public class RedeemResponse {

    public static final String PAID = "PAID";
    public static final String QUEUED = "QUEUED";

    @Schema(description = "상환자 계정", example = "0x00000000000000000000000000000000000000aa")
    private String account;

    @Schema(description = "소각한 토큰 수량", example = "25")
    private BigInteger tokensBurned;

    @Schema(description = "체결 가격 (10^18 스케일)", example = "1000000000000000000")
    private BigInteger execPrice;

    @Schema(description = "수수료 차감 전 금액", example = "25")
    private BigInteger grossAmount;

    @Schema(description = "수수료", example = "0")
    private BigInteger fee;

    @Schema(description = "지급(예정) 순액", example = "25")
    private BigInteger netAmount;

    @Schema(description = "요청 상태: PAID 또는 QUEUED", example = "QUEUED")
    private String status;

    @Schema(description = "같은 호출에서 지급된 내역 (먼저 대기 중이던 요청 포함, FIFO 순서)")
    private List<PayoutResponse> payouts;

    @Schema(description = "호출 후 상환 큐 길이", example = "1")
    private int queueLength;
}
