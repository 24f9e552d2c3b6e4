package dustin.backed.shared.model.dto;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.data.domain.Page;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 페이징 응답 DTO
 * Page Response DTO
 *
 * 엔티티 페이지를 DTO 목록과 페이지 메타데이터로 변환합니다.
 *
 * <pre>
 * PageResponse.of(auditLogRepository.findByAccountOrderByIdDesc(account, pageable), AuditLogResponse::from);
 * </pre>
 *
 * @param <T> 응답 항목 타입
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "페이지 응답")
public class PageResponse<T> {

    @Schema(description = "현재 페이지 항목")
    private List<T> content;

    @Schema(description = "페이지 번호 (0부터)", example = "0")
    private int page;

    @Schema(description = "페이지 크기", example = "20")
    private int size;

    @Schema(description = "전체 항목 수", example = "42")
    private long totalElements;

    @Schema(description = "전체 페이지 수", example = "3")
    private int totalPages;

    @Schema(description = "마지막 페이지 여부", example = "false")
    private boolean last;

    public static <E, T> PageResponse<T> of(Page<E> page, Function<? super E, ? extends T> mapper) {
        List<T> content = page.getContent().stream()
                .map(mapper)
                .collect(Collectors.toList());
        return PageResponse.<T>builder()
                .content(content)
                .page(page.getNumber())
                .size(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .last(page.isLast())
                .build();
    }
}
