package dustin.backed.domains.issuance.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 오라클/브릿지 선택 요청 DTO
 * Name Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "오라클/브릿지 선택 요청")
public class NameRequest {

    @NotBlank(message = "name은 필수입니다")
    @Schema(description = "등록된 빈 이름", example = "manualOracle", required = true)
    private String name;
}
