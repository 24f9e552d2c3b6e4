package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 금액 요청 DTO (버퍼 입출금, 준비자산 승인)
 * Amount Request DTO
 *
 * 0은 승인 해제에만 의미가 있으며, 입출금에서는 서비스가 거부합니다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "금액 요청")
public class AmountRequest {

    @NotNull(message = "amount는 필수입니다")
    @PositiveOrZero(message = "amount는 음수일 수 없습니다")
    @Schema(description = "준비자산 금액", example = "100", required = true)
    private BigInteger amount;
}
