package dustin.backed.domains.issuance.controller;

import static dustin.backed.domains.issuance.controller.IssuanceController.ACCOUNT_HEADER;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.backed.domains.issuance.engine.LiquidityPolicy;
import dustin.backed.domains.issuance.engine.PricingParameters;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.model.dto.AccountBalanceResponse;
import dustin.backed.domains.issuance.model.dto.AccountRequest;
import dustin.backed.domains.issuance.model.dto.AmountRequest;
import dustin.backed.domains.issuance.model.dto.IssuanceConfigResponse;
import dustin.backed.domains.issuance.model.dto.LiquidityConfigRequest;
import dustin.backed.domains.issuance.model.dto.MaxBatchRequest;
import dustin.backed.domains.issuance.model.dto.MintReserveRequest;
import dustin.backed.domains.issuance.model.dto.NameRequest;
import dustin.backed.domains.issuance.model.dto.OraclePriceRequest;
import dustin.backed.domains.issuance.model.dto.PricingConfigRequest;
import dustin.backed.domains.issuance.model.dto.SettleResponse;
import dustin.backed.domains.issuance.service.IssuanceConfigService;
import dustin.backed.domains.issuance.service.SettlementOrchestrator;
import dustin.backed.domains.oracle.ManualPriceOracle;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 발행 관리 컨트롤러
 * Issuance Admin Controller
 *
 * 역할:
 * - 버퍼 입출금, 정산 트리거 (owner / operator)
 * - 발행 설정 변경 (owner)
 * - 수동 오라클 가격 설정, 준비자산 발행 (테스트/운영 보조)
 *
 * 권한:
 * - X-Account-Id 헤더의 계정으로 판단, 권한 없으면 403
 */
@Slf4j
@RestController
@RequestMapping("/api/issuer/admin")
@RequiredArgsConstructor
@Tag(name = "Issuer Admin", description = "발행 관리 API 엔드포인트 (owner / operator)")
public class IssuanceAdminController {

    private final SettlementOrchestrator settlementOrchestrator;
    private final IssuanceConfigService issuanceConfigService;
    private final ManualPriceOracle manualPriceOracle;

    // ============================================
    // 버퍼 / 정산 트리거
    // ============================================

    @Operation(
            summary = "버퍼 입금",
            description = "준비자산을 발행자 보관 계정에 입금하고 상환 큐를 정산합니다. (owner / operator)\n\n" +
                         "입금 전에 `POST /api/issuer/reserve/approve`로 amount 이상 승인해야 합니다."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "입금 및 큐 정산 성공",
                    content = @Content(schema = @Schema(implementation = SettleResponse.class))
            ),
            @ApiResponse(responseCode = "403", description = "owner / operator가 아님"),
            @ApiResponse(responseCode = "409", description = "준비자산 잔고 또는 승인 부족")
    })
    @PostMapping("/buffer/deposit")
    public ResponseEntity<SettleResponse> depositBuffer(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody AmountRequest request
    ) {
        return ResponseEntity.ok(settlementOrchestrator.depositBuffer(AccountId.of(account), request.getAmount()));
    }

    @Operation(summary = "버퍼 출금", description = "보관 계정의 준비자산을 owner에게 이체합니다. (owner)")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "출금 성공"),
            @ApiResponse(responseCode = "403", description = "owner가 아님"),
            @ApiResponse(responseCode = "409", description = "로컬 잔고 부족")
    })
    @PostMapping("/buffer/withdraw")
    public ResponseEntity<SettleResponse> withdrawBuffer(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody AmountRequest request
    ) {
        return ResponseEntity.ok(settlementOrchestrator.withdrawBuffer(AccountId.of(account), request.getAmount()));
    }

    @Operation(summary = "정산", description = "상환 큐를 정산한 뒤 초과분을 브릿지로 전송합니다. (owner / operator)")
    @PostMapping("/settle")
    public ResponseEntity<SettleResponse> settle(@RequestHeader(ACCOUNT_HEADER) String account) {
        return ResponseEntity.ok(settlementOrchestrator.settle(AccountId.of(account)));
    }

    @Operation(summary = "큐 정산", description = "현재 로컬 잔고로 최대 maxBatch 건까지 상환 큐를 지급합니다. (owner / operator)")
    @PostMapping("/drain")
    public ResponseEntity<SettleResponse> drain(@RequestHeader(ACCOUNT_HEADER) String account) {
        return ResponseEntity.ok(settlementOrchestrator.drainQueue(AccountId.of(account)));
    }

    @Operation(summary = "초과분 전송", description = "버퍼 임계값을 넘는 준비자산을 브릿지로 전송합니다. (owner / operator)")
    @PostMapping("/forward")
    public ResponseEntity<SettleResponse> forward(@RequestHeader(ACCOUNT_HEADER) String account) {
        return ResponseEntity.ok(settlementOrchestrator.forwardExcess(AccountId.of(account)));
    }

    // ============================================
    // 설정 (owner)
    // ============================================

    @Operation(summary = "발행 설정 조회", description = "현재 가격 파라미터, 유동성 정책, 계정 설정을 조회합니다.")
    @GetMapping("/config/pricing")
    public ResponseEntity<IssuanceConfigResponse> getConfig() {
        return ResponseEntity.ok(IssuanceConfigResponse.from(issuanceConfigService.snapshot()));
    }

    @Operation(
            summary = "가격 파라미터 변경",
            description = "스프레드(10^18 스케일)와 고정 수수료를 변경합니다. (owner)\n\n" +
                         "redeemSpread가 10^18 이상이면 400을 반환합니다."
    )
    @PutMapping("/config/pricing")
    public ResponseEntity<IssuanceConfigResponse> updatePricing(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody PricingConfigRequest request
    ) {
        PricingParameters pricing = new PricingParameters(request.getBuySpread(), request.getRedeemSpread(),
                request.getBuyFee(), request.getRedeemFee());
        return ResponseEntity.ok(IssuanceConfigResponse.from(
                issuanceConfigService.updatePricing(AccountId.of(account), pricing)));
    }

    @Operation(summary = "유동성 정책 변경", description = "버퍼 임계값과 최소 전송 초과분을 변경합니다. (owner)")
    @PutMapping("/config/liquidity")
    public ResponseEntity<IssuanceConfigResponse> updateLiquidity(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody LiquidityConfigRequest request
    ) {
        LiquidityPolicy policy = new LiquidityPolicy(request.getBufferThreshold(), request.getMinBridgeAmount());
        return ResponseEntity.ok(IssuanceConfigResponse.from(
                issuanceConfigService.updateLiquidityPolicy(AccountId.of(account), policy)));
    }

    @Operation(summary = "최대 배치 크기 변경", description = "정산 호출 1회에 지급할 최대 큐 요청 수를 변경합니다. (owner)")
    @PutMapping("/config/max-batch")
    public ResponseEntity<IssuanceConfigResponse> updateMaxBatch(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody MaxBatchRequest request
    ) {
        return ResponseEntity.ok(IssuanceConfigResponse.from(
                issuanceConfigService.updateMaxBatch(AccountId.of(account), request.getMaxBatch())));
    }

    @Operation(summary = "오라클 선택", description = "등록된 오라클 빈 이름(manualOracle, httpOracle)으로 가격 출처를 바꿉니다. (owner)")
    @PutMapping("/config/oracle")
    public ResponseEntity<IssuanceConfigResponse> updateOracle(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody NameRequest request
    ) {
        return ResponseEntity.ok(IssuanceConfigResponse.from(
                issuanceConfigService.updateOracle(AccountId.of(account), request.getName())));
    }

    @Operation(summary = "브릿지 선택", description = "등록된 브릿지 빈 이름으로 전송 경로를 바꿉니다. (owner)")
    @PutMapping("/config/bridge")
    public ResponseEntity<IssuanceConfigResponse> updateBridge(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody NameRequest request
    ) {
        return ResponseEntity.ok(IssuanceConfigResponse.from(
                issuanceConfigService.updateBridge(AccountId.of(account), request.getName())));
    }

    @Operation(summary = "수수료 수취 계정 변경", description = "(owner)")
    @PutMapping("/config/fee-collector")
    public ResponseEntity<IssuanceConfigResponse> updateFeeCollector(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody AccountRequest request
    ) {
        return ResponseEntity.ok(IssuanceConfigResponse.from(
                issuanceConfigService.updateFeeCollector(AccountId.of(account), AccountId.of(request.getAccount()))));
    }

    @Operation(summary = "operator 변경", description = "(owner)")
    @PutMapping("/config/operator")
    public ResponseEntity<IssuanceConfigResponse> updateOperator(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody AccountRequest request
    ) {
        return ResponseEntity.ok(IssuanceConfigResponse.from(
                issuanceConfigService.updateOperator(AccountId.of(account), AccountId.of(request.getAccount()))));
    }

    @Operation(summary = "owner 이전", description = "설정 권한을 새 계정으로 넘깁니다. 이후 이전 owner는 403을 받습니다. (owner)")
    @PutMapping("/config/owner")
    public ResponseEntity<IssuanceConfigResponse> transferOwnership(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody AccountRequest request
    ) {
        return ResponseEntity.ok(IssuanceConfigResponse.from(
                issuanceConfigService.transferOwnership(AccountId.of(account), AccountId.of(request.getAccount()))));
    }

    // ============================================
    // 오라클 / 준비자산 보조
    // ============================================

    @Operation(summary = "수동 오라클 가격 설정", description = "manualOracle의 가격(10^18 스케일)을 설정합니다. (owner / operator)")
    @PutMapping("/oracle/price")
    public ResponseEntity<IssuanceConfigResponse> updateOraclePrice(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody OraclePriceRequest request
    ) {
        AccountId caller = AccountId.of(account);
        issuanceConfigService.requireOwnerOrOperator(caller, issuanceConfigService.snapshot());
        manualPriceOracle.setPrice(request.getPrice());
        log.info("[IssuanceAdminController] 수동 오라클 가격 설정: by={}, price={}", caller, request.getPrice());
        return ResponseEntity.ok(IssuanceConfigResponse.from(issuanceConfigService.snapshot()));
    }

    @Operation(summary = "준비자산 발행", description = "인메모리 준비자산 원장에 잔고를 발행합니다. (owner)")
    @PostMapping("/reserve/mint")
    public ResponseEntity<AccountBalanceResponse> mintReserve(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @Valid @RequestBody MintReserveRequest request
    ) {
        return ResponseEntity.ok(settlementOrchestrator.mintReserve(AccountId.of(account),
                AccountId.of(request.getAccount()), request.getAmount()));
    }
}
