package dustin.backed.domains.issuance.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 최대 배치 크기 변경 요청 DTO
 * Max Batch Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "최대 배치 크기 변경 요청")
public class MaxBatchRequest {

    @NotNull(message = "maxBatch는 필수입니다")
    @Min(value = 1, message = "maxBatch는 1 이상이어야 합니다")
    @Schema(description = "정산 호출 1회에 지급할 최대 큐 요청 수", example = "50", required = true)
    private Integer maxBatch;
}
