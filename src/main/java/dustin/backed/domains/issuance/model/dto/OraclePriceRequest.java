package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수동 오라클 가격 설정 요청 DTO
 * Oracle Price Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "수동 오라클 가격 설정 요청")
public class OraclePriceRequest {

    @NotNull(message = "price는 필수입니다")
    @Schema(description = "가격 (10^18 스케일, 1.0 = 1000000000000000000)",
            example = "1000000000000000000", required = true)
    private BigInteger price;
}
