package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 견적 응답 DTO
 * Quote Response DTO
 *
 * 상태를 바꾸지 않는 매수/상환 미리보기 결과입니다.
 * - 매수: reserveAmount 입력 → tokenAmount = 발행될 토큰
 * - 상환: tokenAmount 입력 → reserveAmount = 수수료 차감 전 금액, netAmount = 지급액
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "매수/상환 견적")
public class QuoteResponse {

    @Schema(description = "오라클 기준 가격 (10^18 스케일)", example = "1000000000000000000")
    private BigInteger basePrice;

    @Schema(description = "스프레드 적용 체결 가격 (10^18 스케일)", example = "1010000000000000000")
    private BigInteger execPrice;

    @Schema(description = "수수료", example = "1")
    private BigInteger fee;

    @Schema(description = "준비자산 금액 (매수: 입금액, 상환: 수수료 차감 전 금액)", example = "100")
    private BigInteger reserveAmount;

    @Schema(description = "수수료 차감 후 순액", example = "99")
    private BigInteger netAmount;

    @Schema(description = "토큰 수량 (매수: 발행될 수량, 상환: 소각할 수량)", example = "98")
    private BigInteger tokenAmount;
}
