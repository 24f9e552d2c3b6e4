package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 가격 파라미터 변경 요청 DTO
 * Pricing Config Request DTO
 *
 * 스프레드는 10^18 스케일 (1% = 10000000000000000), 수수료는 준비자산 최소 단위
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "가격 파라미터 변경 요청")
public class PricingConfigRequest {

    @NotNull(message = "buySpread는 필수입니다")
    @PositiveOrZero(message = "buySpread는 음수일 수 없습니다")
    @Schema(description = "매수 스프레드 (10^18 스케일)", example = "10000000000000000", required = true)
    private BigInteger buySpread;

    @NotNull(message = "redeemSpread는 필수입니다")
    @PositiveOrZero(message = "redeemSpread는 음수일 수 없습니다")
    @Schema(description = "상환 스프레드 (10^18 스케일, 10^18 미만)", example = "10000000000000000", required = true)
    private BigInteger redeemSpread;

    @NotNull(message = "buyFee는 필수입니다")
    @PositiveOrZero(message = "buyFee는 음수일 수 없습니다")
    @Schema(description = "매수 고정 수수료", example = "1", required = true)
    private BigInteger buyFee;

    @NotNull(message = "redeemFee는 필수입니다")
    @PositiveOrZero(message = "redeemFee는 음수일 수 없습니다")
    @Schema(description = "상환 고정 수수료", example = "1", required = true)
    private BigInteger redeemFee;
}
