package dustin.backed.domains.issuance.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정 변경 요청 DTO (수수료 수취, operator, owner)
 * Account Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계정 변경 요청")
public class AccountRequest {

    public static final String ACCOUNT_PATTERN = "^0x[0-9a-fA-F]{40}$";

    @NotBlank(message = "account는 필수입니다")
    @Pattern(regexp = ACCOUNT_PATTERN, message = "account는 0x + 16진수 40자리여야 합니다")
    @Schema(description = "계정", example = "0x0000000000000000000000000000000000000003", required = true)
    private String account;
}
