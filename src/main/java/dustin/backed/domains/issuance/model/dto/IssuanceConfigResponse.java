package dustin.backed.domains.issuance.model.dto;

import java.math.BigInteger;

import dustin.backed.domains.issuance.service.IssuanceSettings;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 발행 설정 응답 DTO
 * Issuance Config Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "현재 발행 설정")
public class IssuanceConfigResponse {

    @Schema(description = "매수 스프레드 (10^18 스케일)", example = "0")
    private BigInteger buySpread;

    @Schema(description = "상환 스프레드 (10^18 스케일)", example = "0")
    private BigInteger redeemSpread;

    @Schema(description = "매수 고정 수수료", example = "0")
    private BigInteger buyFee;

    @Schema(description = "상환 고정 수수료", example = "0")
    private BigInteger redeemFee;

    @Schema(description = "버퍼 임계값", example = "50")
    private BigInteger bufferThreshold;

    @Schema(description = "브릿지 전송 최소 초과분", example = "0")
    private BigInteger minBridgeAmount;

    @Schema(description = "최대 배치 크기", example = "50")
    private int maxBatch;

    @Schema(description = "사용 중인 오라클", example = "manualOracle")
    private String oracle;

    @Schema(description = "사용 중인 브릿지", example = "reserveBridge")
    private String bridge;

    @Schema(description = "수수료 수취 계정")
    private String feeCollector;

    @Schema(description = "operator 계정")
    private String operator;

    @Schema(description = "owner 계정")
    private String owner;

    public static IssuanceConfigResponse from(IssuanceSettings settings) {
        return IssuanceConfigResponse.builder()
                .buySpread(settings.getPricing().getBuySpread())
                .redeemSpread(settings.getPricing().getRedeemSpread())
                .buyFee(settings.getPricing().getBuyFee())
                .redeemFee(settings.getPricing().getRedeemFee())
                .bufferThreshold(settings.getLiquidityPolicy().getBufferThreshold())
                .minBridgeAmount(settings.getLiquidityPolicy().getMinBridgeAmount())
                .maxBatch(settings.getMaxBatch())
                .oracle(settings.getOracleName())
                .bridge(settings.getBridgeName())
                .feeCollector(settings.getFeeCollector().toHex())
                .operator(settings.getOperator().toHex())
                .owner(settings.getOwner().toHex())
                .build();
    }
}
