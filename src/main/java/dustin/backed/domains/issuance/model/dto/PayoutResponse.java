package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import dustin.backed.domains.issuance.engine.RedemptionRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상환 지급 DTO
 * Payout DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "상환 지급 내역 (또는 대기 중인 상환 요청)")
public class PayoutResponse {

    @Schema(description = "수혜자 계정", example = "0x00000000000000000000000000000000000000aa")
    private String beneficiary;

    @Schema(description = "준비자산 금액", example = "25")
    private BigInteger amount;

    public static PayoutResponse from(RedemptionRequest request) {
        return new PayoutResponse(request.getBeneficiary().toHex(), request.getAmount());
    }
}
