package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 유동성 정책 변경 요청 DTO
 * Liquidity Config Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "유동성 정책 변경 요청")
public class LiquidityConfigRequest {

    @NotNull(message = "bufferThreshold는 필수입니다")
    @PositiveOrZero(message = "bufferThreshold는 음수일 수 없습니다")
    @Schema(description = "로컬에 남길 버퍼 금액", example = "50", required = true)
    private BigInteger bufferThreshold;

    @NotNull(message = "minBridgeAmount는 필수입니다")
    @PositiveOrZero(message = "minBridgeAmount는 음수일 수 없습니다")
    @Schema(description = "브릿지 전송 최소 초과분", example = "0", required = true)
    private BigInteger minBridgeAmount;
}
