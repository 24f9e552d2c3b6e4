package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 준비자산 발행 요청 DTO (인메모리 원장 faucet)
 * Mint Reserve Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "준비자산 발행 요청")
public class MintReserveRequest {

    @NotBlank(message = "account는 필수입니다")
    @Pattern(regexp = AccountRequest.ACCOUNT_PATTERN, message = "account는 0x + 16진수 40자리여야 합니다")
    @Schema(description = "받을 계정", example = "0x00000000000000000000000000000000000000aa", required = true)
    private String account;

    @NotNull(message = "amount는 필수입니다")
    @Positive(message = "amount는 0보다 커야 합니다")
    @Schema(description = "발행할 준비자산 금액", example = "1000", required = true)
    private BigInteger amount;
}
