package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상환 요청 DTO
 * Redeem Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "상환 요청")
public class RedeemRequest {

    @NotNull(message = "tokenAmount는 필수입니다")
    @Positive(message = "tokenAmount는 0보다 커야 합니다")
    @Schema(description = "소각할 토큰 수량", example = "25", required = true)
    private BigInteger tokenAmount;
}
