package dustin.backed.domains.issuance.controller;

import java.math.BigInteger;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.model.dto.AccountBalanceResponse;
import dustin.backed.domains.issuance.model.dto.AmountRequest;
import dustin.backed.domains.issuance.model.dto.AuditLogResponse;
import dustin.backed.domains.issuance.model.dto.BuyRequest;
import dustin.backed.domains.issuance.model.dto.BuyResponse;
import dustin.backed.domains.issuance.model.dto.QueueResponse;
import dustin.backed.domains.issuance.model.dto.QuoteResponse;
import dustin.backed.domains.issuance.model.dto.RedeemRequest;
import dustin.backed.domains.issuance.model.dto.RedeemResponse;
import dustin.backed.domains.issuance.service.SettlementAuditService;
import dustin.backed.domains.issuance.service.SettlementOrchestrator;
import dustin.backed.shared.model.dto.PageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 발행 컨트롤러
 * Issuance Controller
 *
 * 역할:
 * - 매수/상환 및 견적, 잔고/큐/감사 로그 조회 REST API
 *
 * API 엔드포인트:
 * - POST /api/issuer/buy - 매수 (준비자산 → 토큰)
 * - POST /api/issuer/redeem - 상환 (토큰 → 준비자산, 유동성 부족 시 큐 대기)
 * - POST /api/issuer/reserve/approve - 보관 계정 앞으로 준비자산 사용 승인
 * - GET /api/issuer/quote/buy - 매수 견적
 * - GET /api/issuer/quote/redeem - 상환 견적
 * - GET /api/issuer/balances/{account} - 계정 잔고
 * - GET /api/issuer/queue - 상환 큐 상태
 * - GET /api/issuer/audit/{account} - 계정별 감사 로그
 *
 * 호출자 식별: X-Account-Id 헤더 (0x + 16진수 40자리)
 */
@RestController
@RequestMapping("/api/issuer")
@RequiredArgsConstructor
@Tag(name = "Issuer", description = "매수/상환 API 엔드포인트")
public class IssuanceController {

    public static final String ACCOUNT_HEADER = "X-Account-Id";

    private final SettlementOrchestrator settlementOrchestrator;
    private final SettlementAuditService settlementAuditService;

    /**
     * 매수
     * Buy
     *
     * 응답:
     * - 200: 매수 성공
     * - 400: 잘못된 금액 (0, 수수료 이하, 발행 수량 0)
     * - 409: 준비자산 잔고 또는 승인 부족
     * - 502: 오라클/브릿지 호출 실패
     */
    @Operation(
            summary = "매수",
            description = "준비자산을 입금하고 합성 토큰을 발행합니다.\n\n" +
                         "**사전 조건:** `POST /api/issuer/reserve/approve`로 reserveAmount 이상 승인\n\n" +
                         "**요청 예시:**\n" +
                         "```json\n" +
                         "{ \"reserveAmount\": 100 }\n" +
                         "```"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "매수 성공",
                    content = @Content(schema = @Schema(implementation = BuyResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "잘못된 금액"),
            @ApiResponse(responseCode = "409", description = "준비자산 잔고 또는 승인 부족"),
            @ApiResponse(responseCode = "502", description = "오라클/브릿지 호출 실패")
    })
    @PostMapping("/buy")
    public ResponseEntity<BuyResponse> buy(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody BuyRequest request
    ) {
        BuyResponse response = settlementOrchestrator.buy(AccountId.of(account), request.getReserveAmount());
        return ResponseEntity.ok(response);
    }

    /**
     * 상환
     * Redeem
     *
     * 응답:
     * - 200: 상환 성공 (status = PAID 또는 QUEUED)
     * - 400: 잘못된 수량 (0, 수수료 이하)
     * - 409: 토큰 잔고 부족
     */
    @Operation(
            summary = "상환",
            description = "합성 토큰을 소각하고 준비자산을 받습니다.\n\n" +
                         "로컬 유동성이 부족하거나 먼저 대기 중인 요청이 있으면 상환 큐 끝에 추가되고 " +
                         "(`status: QUEUED`), 유동성이 보충될 때 순서대로 지급됩니다."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "상환 성공",
                    content = @Content(schema = @Schema(implementation = RedeemResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "잘못된 수량"),
            @ApiResponse(responseCode = "409", description = "토큰 잔고 부족")
    })
    @PostMapping("/redeem")
    public ResponseEntity<RedeemResponse> redeem(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody RedeemRequest request
    ) {
        RedeemResponse response = settlementOrchestrator.redeem(AccountId.of(account), request.getTokenAmount());
        return ResponseEntity.ok(response);
    }

    @Operation(
            summary = "준비자산 사용 승인",
            description = "발행자 보관 계정이 호출자의 준비자산을 amount까지 가져갈 수 있도록 승인합니다. " +
                         "기존 승인은 덮어씁니다."
    )
    @PostMapping("/reserve/approve")
    public ResponseEntity<AccountBalanceResponse> approveReserve(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody AmountRequest request
    ) {
        return ResponseEntity.ok(settlementOrchestrator.approveReserve(AccountId.of(account), request.getAmount()));
    }

    @Operation(summary = "매수 견적", description = "상태를 바꾸지 않고 매수 체결 가격, 수수료, 발행될 토큰 수량을 계산합니다.")
    @GetMapping("/quote/buy")
    public ResponseEntity<QuoteResponse> quoteBuy(
            @Parameter(description = "입금할 준비자산 총액", example = "100")
            @RequestParam BigInteger reserveAmount
    ) {
        return ResponseEntity.ok(settlementOrchestrator.previewBuy(reserveAmount));
    }

    @Operation(summary = "상환 견적", description = "상태를 바꾸지 않고 상환 체결 가격, 수수료, 지급액을 계산합니다.")
    @GetMapping("/quote/redeem")
    public ResponseEntity<QuoteResponse> quoteRedeem(
            @Parameter(description = "소각할 토큰 수량", example = "25")
            @RequestParam BigInteger tokenAmount
    ) {
        return ResponseEntity.ok(settlementOrchestrator.previewRedeem(tokenAmount));
    }

    @Operation(summary = "계정 잔고 조회", description = "준비자산 잔고, 보관 계정 앞 승인 한도, 토큰 잔고를 조회합니다.")
    @GetMapping("/balances/{account}")
    public ResponseEntity<AccountBalanceResponse> getBalances(@PathVariable String account) {
        return ResponseEntity.ok(settlementOrchestrator.balances(AccountId.of(account)));
    }

    @Operation(summary = "상환 큐 조회", description = "head, tail, 대기 요청 수와 금액 합계, head부터 최대 limit개의 요청을 조회합니다.")
    @GetMapping("/queue")
    public ResponseEntity<QueueResponse> getQueue(
            @Parameter(description = "조회할 최대 요청 수", example = "20")
            @RequestParam(defaultValue = "20") int limit
    ) {
        return ResponseEntity.ok(settlementOrchestrator.queueStatus(limit));
    }

    @Operation(summary = "감사 로그 조회", description = "계정별 정산 감사 로그를 최신순으로 조회합니다.")
    @GetMapping("/audit/{account}")
    public ResponseEntity<PageResponse<AuditLogResponse>> getAuditLogs(
            @PathVariable String account,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(settlementAuditService.findByAccount(AccountId.of(account), page, size));
    }
}
