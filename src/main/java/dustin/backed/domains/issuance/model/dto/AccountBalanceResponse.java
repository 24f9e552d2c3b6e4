package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정 잔고 응답 DTO
 * Account Balance Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계정 잔고")
public class AccountBalanceResponse {

    @Schema(description = "계정", example = "0x00000000000000000000000000000000000000aa")
    private String account;

    @Schema(description = "준비자산 잔고", example = "1000")
    private BigInteger reserveBalance;

    @Schema(description = "발행자 앞으로 승인한 준비자산 한도", example = "100")
    private BigInteger reserveAllowance;

    @Schema(description = "합성 토큰 잔고", example = "99")
    private BigInteger tokenBalance;

    @Schema(description = "합성 토큰 총 발행량", example = "99")
    private BigInteger totalSupply;
}
