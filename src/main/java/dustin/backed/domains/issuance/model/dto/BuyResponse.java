package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 매수 응답 DTO
 * Buy Response DTO
 *
 * 역할:
 * - 매수 체결 결과 (체결 가격, 수수료, 발행 토큰 수량)
 * - 자동 정산이 켜져 있으면 같은 호출에서 처리된 큐 지급과 브릿지 전송 금액
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "매수 결과")
public class BuyResponse {

    @Schema(description = "매수자 계정", example = "0x00000000000000000000000000000000000000aa")
    private String account;

    @Schema(description = "입금한 준비자산 총액 (수수료 포함)", example = "100")
    private BigInteger reserveAmount;

    @Schema(description = "수수료", example = "1")
    private BigInteger fee;

    @Schema(description = "수수료 차감 후 순액", example = "99")
    private BigInteger netAmount;

    @Schema(description = "체결 가격 (10^18 스케일)", example = "1000000000000000000")
    private BigInteger execPrice;

    @Schema(description = "발행된 토큰 수량", example = "99")
    private BigInteger tokensMinted;

    @Schema(description = "같은 호출에서 지급된 대기 상환 요청")
    private List<PayoutResponse> payouts;

    @Schema(description = "브릿지로 전송된 금액", example = "0")
    private BigInteger forwardedAmount;

    @Schema(description = "호출 후 상환 큐 길이", example = "0")
    private int queueLength;
}
