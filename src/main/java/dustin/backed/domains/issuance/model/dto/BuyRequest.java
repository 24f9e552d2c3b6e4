package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 매수 요청 DTO
 * Buy Request DTO
 *
 * 매수 전에 보관 계정 앞으로 reserveAmount 이상을 승인해 두어야 합니다.
 * (POST /api/issuer/reserve/approve)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "매수 요청")
public class BuyRequest {

    /**
     * 입금할 준비자산 총액 (수수료 포함, 최소 단위)
     */
    @NotNull(message = "reserveAmount는 필수입니다")
    @Positive(message = "reserveAmount는 0보다 커야 합니다")
    @Schema(description = "입금할 준비자산 총액 (수수료 포함)", example = "100", required = true)
    private BigInteger reserveAmount;
}
