package dustin.backed.domains.issuance.service;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import dustin.backed.config.IssuerProperties;
import dustin.backed.domains.bridge.BridgeGateway;
import dustin.backed.domains.issuance.engine.FixedPoint;
import dustin.backed.domains.issuance.engine.ForwardInstruction;
import dustin.backed.domains.issuance.engine.LiquidityController;
import dustin.backed.domains.issuance.engine.PricingEngine;
import dustin.backed.domains.issuance.engine.QueueProcessResult;
import dustin.backed.domains.issuance.engine.Quote;
import dustin.backed.domains.issuance.engine.RedemptionQueue;
import dustin.backed.domains.issuance.engine.RedemptionRequest;
import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.model.SettlementAction;
import dustin.backed.domains.issuance.model.SettlementRecord;
import dustin.backed.domains.issuance.model.SettlementRecordCodec;
import dustin.backed.domains.issuance.model.dto.AccountBalanceResponse;
import dustin.backed.domains.issuance.model.dto.BuyResponse;
import dustin.backed.domains.issuance.model.dto.PayoutResponse;
import dustin.backed.domains.issuance.model.dto.QueueResponse;
import dustin.backed.domains.issuance.model.dto.QuoteResponse;
import dustin.backed.domains.issuance.model.dto.RedeemResponse;
import dustin.backed.domains.issuance.model.dto.SettleResponse;
import dustin.backed.domains.issuance.model.entity.SettlementAuditLog.AuditAction;
import dustin.backed.domains.ledger.ReserveAsset;
import dustin.backed.domains.ledger.SyntheticTokenLedger;
import dustin.backed.domains.oracle.PriceOracle;
import lombok.extern.slf4j.Slf4j;

/**
 * 정산 오케스트레이터
 * Settlement Orchestrator
 *
 * 역할:
 * - 가격 엔진, 상환 큐, 유동성 컨트롤러를 묶어 매수/상환/버퍼 입출금/정산 실행
 * - 준비자산 원장과 합성 토큰 원장에 대한 모든 변경을 한 곳에서 수행
 *
 * 처리 과정 (매수):
 * 1. 설정 스냅샷 1회 읽기 → 오라클 가격 → 매수 견적
 * 2. 준비자산 수취 (보관 계정 잔고가 정확히 그만큼 늘었는지 확인)
 * 3. 수수료 지급 → BUY 정산 레코드 → 토큰 발행
 * 4. 자동 정산이 켜져 있으면 큐 정산 → 초과분 브릿지 전송
 *
 * 처리 과정 (상환):
 * 1. 토큰 소각 → 수수료 지급 → REDEEM 정산 레코드
 * 2. 큐 처리 (유동성이 충분하고 앞선 대기 요청이 없으면 즉시 지급, 아니면 큐 끝에 추가)
 * 3. 지급 목록을 준비자산 이체로 실행
 *
 * 동시성:
 * - 공정(fair) ReentrantLock 하나로 상환 큐와 로컬 잔고를 보호
 * - 모든 작업은 락을 잡은 채로 끝까지 실행
 *
 * 원자성:
 * - 외부 원장 변경마다 보상 작업을 SettlementJournal에 기록
 * - 실패 시 역순 보상 + 큐 복원 → 호출 전 상태
 * - 브릿지 메시지와 감사 로그는 커밋 후에만 발행
 * - 브릿지 전송은 되돌릴 수 없으므로 항상 마지막 단계
 */
@Slf4j
@Service
public class SettlementOrchestrator {

    private final IssuanceConfigService configService;
    private final SettlementAuditService auditService;
    private final ReserveAsset reserveAsset;
    private final SyntheticTokenLedger tokenLedger;
    private final PricingEngine pricingEngine;
    private final LiquidityController liquidityController;
    private final RedemptionQueue queue;
    private final AccountId custody;
    private final boolean autoSettle;

    private final ReentrantLock lock = new ReentrantLock(true);

    public SettlementOrchestrator(
            IssuanceConfigService configService,
            SettlementAuditService auditService,
            ReserveAsset reserveAsset,
            SyntheticTokenLedger tokenLedger,
            PricingEngine pricingEngine,
            LiquidityController liquidityController,
            IssuerProperties properties) {
        this.configService = configService;
        this.auditService = auditService;
        this.reserveAsset = reserveAsset;
        this.tokenLedger = tokenLedger;
        this.pricingEngine = pricingEngine;
        this.liquidityController = liquidityController;
        this.queue = new RedemptionQueue(properties.getQueue().getStorage().create());
        this.custody = AccountId.of(properties.getCustodyAccount());
        this.autoSettle = properties.getSettlement().isAutoSettle();

        log.info("[SettlementOrchestrator] 초기화: custody={}, queueStorage={}, autoSettle={}",
                custody, properties.getQueue().getStorage(), autoSettle);
    }

    // ============================================
    // 매수 / 상환
    // ============================================

    /**
     * 매수: 준비자산을 받고 합성 토큰 발행
     *
     * @param spender 매수자 (보관 계정 앞으로 reserveAmount 이상 승인해 두어야 함)
     * @param reserveAmount 입금할 준비자산 총액 (수수료 포함)
     * @throws IssuanceException INVALID_INPUT (0, 수수료 이하, 발행 수량 0),
     *         INSUFFICIENT_BALANCE (잔고/승인 부족), EXTERNAL_CALL_FAILURE (오라클/브릿지 실패)
     */
    public BuyResponse buy(AccountId spender, BigInteger reserveAmount) {
        requireAccount(spender, "spender");
        FixedPoint.requirePositive(reserveAmount, "reserveAmount");

        IssuanceSettings settings = configService.snapshot();
        Quote quote = pricingEngine.buyQuote(fetchPrice(settings), settings.getPricing());
        if (reserveAmount.compareTo(quote.getFee()) <= 0) {
            throw IssuanceException.invalidInput("reserveAmount must exceed the buy fee: amount="
                    + reserveAmount + ", fee=" + quote.getFee());
        }
        BigInteger net = reserveAmount.subtract(quote.getFee());
        BigInteger tokens = pricingEngine.tokensForReserve(net, quote.getExecPrice());
        if (tokens.signum() == 0) {
            throw IssuanceException.invalidInput("reserveAmount too small to mint any token: net="
                    + net + ", execPrice=" + quote.getExecPrice());
        }

        lock.lock();
        SettlementJournal journal = new SettlementJournal("buy");
        try {
            log.info("[SettlementOrchestrator] 매수 시작: spender={}, reserveAmount={}, execPrice={}, fee={}",
                    spender, reserveAmount, quote.getExecPrice(), quote.getFee());

            pullReserve(spender, reserveAmount, journal);
            payFee(settings, quote.getFee(), journal);
            emitRecord(settings, SettlementAction.BUY, spender, net, journal);

            tokenLedger.mint(spender, tokens);
            journal.record("mint " + tokens + " to " + spender, () -> tokenLedger.burn(spender, tokens));

            List<RedemptionRequest> payouts = Collections.emptyList();
            BigInteger forwarded = BigInteger.ZERO;
            if (autoSettle) {
                payouts = drainInternal(settings, journal);
                forwarded = forwardInternal(settings, journal);
            }

            journal.afterCommit(() -> auditService.record(AuditAction.BUY, spender, net, tokens,
                    quote.getExecPrice(), queue.length()));
            journal.commit();

            log.info("[SettlementOrchestrator] 매수 완료: spender={}, net={}, tokens={}, payouts={}, forwarded={}",
                    spender, net, tokens, payouts.size(), forwarded);

            return BuyResponse.builder()
                    .account(spender.toHex())
                    .reserveAmount(reserveAmount)
                    .fee(quote.getFee())
                    .netAmount(net)
                    .execPrice(quote.getExecPrice())
                    .tokensMinted(tokens)
                    .payouts(toPayoutResponses(payouts))
                    .forwardedAmount(forwarded)
                    .queueLength(queue.length())
                    .build();
        } catch (RuntimeException e) {
            journal.rollback(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 상환: 합성 토큰을 소각하고 준비자산 지급 (유동성 부족 시 큐 대기)
     *
     * @param holder 토큰 보유자
     * @param tokenAmount 소각할 토큰 수량
     * @throws IssuanceException INVALID_INPUT (0, 수수료 이하), INSUFFICIENT_BALANCE (토큰 부족,
     *         보관 계정이 수수료를 지급할 수 없음), EXTERNAL_CALL_FAILURE (오라클 실패)
     */
    public RedeemResponse redeem(AccountId holder, BigInteger tokenAmount) {
        requireAccount(holder, "holder");
        FixedPoint.requirePositive(tokenAmount, "tokenAmount");

        IssuanceSettings settings = configService.snapshot();
        Quote quote = pricingEngine.redeemQuote(fetchPrice(settings), settings.getPricing());
        BigInteger gross = pricingEngine.reserveForTokens(tokenAmount, quote.getExecPrice());
        if (gross.compareTo(quote.getFee()) <= 0) {
            throw IssuanceException.invalidInput("Redemption value must exceed the redeem fee: gross="
                    + gross + ", fee=" + quote.getFee());
        }
        BigInteger net = gross.subtract(quote.getFee());

        lock.lock();
        SettlementJournal journal = new SettlementJournal("redeem");
        try {
            log.info("[SettlementOrchestrator] 상환 시작: holder={}, tokens={}, execPrice={}, gross={}, fee={}",
                    holder, tokenAmount, quote.getExecPrice(), gross, quote.getFee());

            tokenLedger.burn(holder, tokenAmount);
            journal.record("burn " + tokenAmount + " from " + holder, () -> tokenLedger.mint(holder, tokenAmount));

            payFee(settings, quote.getFee(), journal);
            emitRecord(settings, SettlementAction.REDEEM, holder, net, journal);

            QueueProcessResult result = processQueue(new RedemptionRequest(holder, net), settings, journal);
            List<RedemptionRequest> payouts = result.getPayouts();
            if (result.isNewRequestQueued()) {
                journal.afterCommit(() -> auditService.record(AuditAction.REDEMPTION_QUEUED, holder, net,
                        null, null, queue.length()));
            }
            journal.afterCommit(() -> auditService.record(AuditAction.REDEEM, holder, net, tokenAmount,
                    quote.getExecPrice(), queue.length()));
            journal.commit();

            String status = result.isNewRequestPaid() ? RedeemResponse.PAID : RedeemResponse.QUEUED;
            log.info("[SettlementOrchestrator] 상환 완료: holder={}, net={}, status={}, payouts={}, queueLength={}",
                    holder, net, status, payouts.size(), queue.length());

            return RedeemResponse.builder()
                    .account(holder.toHex())
                    .tokensBurned(tokenAmount)
                    .execPrice(quote.getExecPrice())
                    .grossAmount(gross)
                    .fee(quote.getFee())
                    .netAmount(net)
                    .status(status)
                    .payouts(toPayoutResponses(payouts))
                    .queueLength(queue.length())
                    .build();
        } catch (RuntimeException e) {
            journal.rollback(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    // ============================================
    // 버퍼 입출금
    // ============================================

    /**
     * 버퍼 입금: 준비자산을 보관 계정으로 넣고 상환 큐 정산
     *
     * 브릿지 전송은 하지 않습니다 (forwardExcess / settle 로 별도 실행).
     *
     * @param caller owner 또는 operator (보관 계정 앞으로 amount 이상 승인해 두어야 함)
     */
    public SettleResponse depositBuffer(AccountId caller, BigInteger amount) {
        FixedPoint.requirePositive(amount, "amount");
        IssuanceSettings settings = configService.snapshot();
        configService.requireOwnerOrOperator(caller, settings);

        lock.lock();
        SettlementJournal journal = new SettlementJournal("depositBuffer");
        try {
            pullReserve(caller, amount, journal);
            List<RedemptionRequest> payouts = drainInternal(settings, journal);

            journal.afterCommit(() -> auditService.record(AuditAction.BUFFER_DEPOSIT, caller, amount,
                    null, null, queue.length()));
            journal.commit();

            log.info("[SettlementOrchestrator] 버퍼 입금 완료: caller={}, amount={}, payouts={}, queueLength={}",
                    caller, amount, payouts.size(), queue.length());
            return settleResponse(payouts, BigInteger.ZERO);
        } catch (RuntimeException e) {
            journal.rollback(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 버퍼 출금: 보관 계정의 준비자산을 owner에게 이체
     *
     * @param caller owner
     * @throws IssuanceException INSUFFICIENT_BALANCE 로컬 잔고 부족
     */
    public SettleResponse withdrawBuffer(AccountId caller, BigInteger amount) {
        FixedPoint.requirePositive(amount, "amount");
        IssuanceSettings settings = configService.snapshot();
        configService.requireOwner(caller, settings);

        lock.lock();
        try {
            BigInteger localBalance = reserveAsset.balanceOf(custody);
            if (localBalance.compareTo(amount) < 0) {
                throw IssuanceException.insufficientBalance("Local reserve balance too low: balance="
                        + localBalance + ", requested=" + amount);
            }
            reserveAsset.transfer(custody, caller, amount);
            auditService.record(AuditAction.BUFFER_WITHDRAW, caller, amount, null, null, queue.length());

            log.info("[SettlementOrchestrator] 버퍼 출금 완료: caller={}, amount={}, localBalance={}",
                    caller, amount, reserveAsset.balanceOf(custody));
            return settleResponse(Collections.emptyList(), BigInteger.ZERO);
        } finally {
            lock.unlock();
        }
    }

    // ============================================
    // 정산 트리거 (owner / operator)
    // ============================================

    /**
     * 큐 정산: 현재 로컬 잔고로 최대 maxBatch 건까지 FIFO 지급
     */
    public SettleResponse drainQueue(AccountId caller) {
        IssuanceSettings settings = configService.snapshot();
        configService.requireOwnerOrOperator(caller, settings);
        return runSettlement("drainQueue", settings, true, false);
    }

    /**
     * 초과분 브릿지 전송
     */
    public SettleResponse forwardExcess(AccountId caller) {
        IssuanceSettings settings = configService.snapshot();
        configService.requireOwnerOrOperator(caller, settings);
        return runSettlement("forwardExcess", settings, false, true);
    }

    /**
     * 큐 정산 후 초과분 브릿지 전송
     */
    public SettleResponse settle(AccountId caller) {
        IssuanceSettings settings = configService.snapshot();
        configService.requireOwnerOrOperator(caller, settings);
        return runSettlement("settle", settings, true, true);
    }

    private SettleResponse runSettlement(String operation, IssuanceSettings settings, boolean drain, boolean forward) {
        lock.lock();
        SettlementJournal journal = new SettlementJournal(operation);
        try {
            List<RedemptionRequest> payouts = drain ? drainInternal(settings, journal) : Collections.emptyList();
            BigInteger forwarded = forward ? forwardInternal(settings, journal) : BigInteger.ZERO;
            journal.commit();

            log.info("[SettlementOrchestrator] {} 완료: payouts={}, forwarded={}, queueLength={}, localBalance={}",
                    operation, payouts.size(), forwarded, queue.length(), reserveAsset.balanceOf(custody));
            return settleResponse(payouts, forwarded);
        } catch (RuntimeException e) {
            journal.rollback(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    // ============================================
    // 견적 (상태 변경 없음)
    // ============================================

    public QuoteResponse previewBuy(BigInteger reserveAmount) {
        FixedPoint.requirePositive(reserveAmount, "reserveAmount");
        IssuanceSettings settings = configService.snapshot();
        Quote quote = pricingEngine.buyQuote(fetchPrice(settings), settings.getPricing());

        BigInteger net = reserveAmount.compareTo(quote.getFee()) > 0
                ? reserveAmount.subtract(quote.getFee())
                : BigInteger.ZERO;
        return QuoteResponse.builder()
                .basePrice(quote.getBasePrice())
                .execPrice(quote.getExecPrice())
                .fee(quote.getFee())
                .reserveAmount(reserveAmount)
                .netAmount(net)
                .tokenAmount(pricingEngine.tokensForReserve(net, quote.getExecPrice()))
                .build();
    }

    public QuoteResponse previewRedeem(BigInteger tokenAmount) {
        FixedPoint.requirePositive(tokenAmount, "tokenAmount");
        IssuanceSettings settings = configService.snapshot();
        Quote quote = pricingEngine.redeemQuote(fetchPrice(settings), settings.getPricing());

        BigInteger gross = pricingEngine.reserveForTokens(tokenAmount, quote.getExecPrice());
        BigInteger net = gross.compareTo(quote.getFee()) > 0 ? gross.subtract(quote.getFee()) : BigInteger.ZERO;
        return QuoteResponse.builder()
                .basePrice(quote.getBasePrice())
                .execPrice(quote.getExecPrice())
                .fee(quote.getFee())
                .reserveAmount(gross)
                .netAmount(net)
                .tokenAmount(tokenAmount)
                .build();
    }

    // ============================================
    // 준비자산 원장 (사용자 승인 / 테스트용 발행)
    // ============================================

    /**
     * 보관 계정 앞으로 준비자산 사용 승인 (기존 승인을 덮어씀)
     */
    public AccountBalanceResponse approveReserve(AccountId owner, BigInteger amount) {
        requireAccount(owner, "owner");
        FixedPoint.requireUint256(amount, "amount");
        reserveAsset.approve(owner, custody, amount);
        log.info("[SettlementOrchestrator] 준비자산 승인: owner={}, amount={}", owner, amount);
        return balances(owner);
    }

    /**
     * 준비자산 발행 (인메모리 원장의 faucet, owner 전용)
     */
    public AccountBalanceResponse mintReserve(AccountId caller, AccountId to, BigInteger amount) {
        requireAccount(to, "to");
        FixedPoint.requirePositive(amount, "amount");
        configService.requireOwner(caller, configService.snapshot());
        reserveAsset.mint(to, amount);
        log.info("[SettlementOrchestrator] 준비자산 발행: to={}, amount={}", to, amount);
        return balances(to);
    }

    // ============================================
    // 조회
    // ============================================

    public AccountBalanceResponse balances(AccountId account) {
        return AccountBalanceResponse.builder()
                .account(account.toHex())
                .reserveBalance(reserveAsset.balanceOf(account))
                .reserveAllowance(reserveAsset.allowance(account, custody))
                .tokenBalance(tokenLedger.balanceOf(account))
                .totalSupply(tokenLedger.totalSupply())
                .build();
    }

    public QueueResponse queueStatus(int limit) {
        if (limit < 0) {
            throw IssuanceException.invalidInput("limit must not be negative: " + limit);
        }
        lock.lock();
        try {
            return QueueResponse.builder()
                    .head(queue.head())
                    .tail(queue.tail())
                    .length(queue.length())
                    .pendingTotal(queue.pendingTotal())
                    .localBalance(reserveAsset.balanceOf(custody))
                    .entries(toPayoutResponses(queue.snapshot(limit)))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int queueLength() {
        lock.lock();
        try {
            return queue.length();
        } finally {
            lock.unlock();
        }
    }

    public BigInteger localBalance() {
        return reserveAsset.balanceOf(custody);
    }

    public AccountId custodyAccount() {
        return custody;
    }

    // ============================================
    // 내부 단계 (락 안에서만 호출)
    // ============================================

    /**
     * 준비자산 수취: 보관 계정 잔고가 정확히 amount만큼 늘었는지 확인
     */
    private void pullReserve(AccountId from, BigInteger amount, SettlementJournal journal) {
        BigInteger allowanceBefore = reserveAsset.allowance(from, custody);
        BigInteger balanceBefore = reserveAsset.balanceOf(custody);

        reserveAsset.transferFrom(custody, from, custody, amount);

        BigInteger received = reserveAsset.balanceOf(custody).subtract(balanceBefore);
        journal.record("pull " + received + " from " + from, () -> {
            if (received.signum() > 0) {
                reserveAsset.transfer(custody, from, received);
            }
            reserveAsset.approve(from, custody, allowanceBefore);
        });

        if (received.compareTo(amount) != 0) {
            throw IssuanceException.externalCallFailure("Reserve transfer delivered " + received
                    + " instead of " + amount, null);
        }
    }

    private void payFee(IssuanceSettings settings, BigInteger fee, SettlementJournal journal) {
        if (fee.signum() == 0) {
            return;
        }
        AccountId collector = settings.getFeeCollector();
        reserveAsset.transfer(custody, collector, fee);
        journal.record("fee " + fee + " to " + collector, () -> reserveAsset.transfer(collector, custody, fee));
    }

    private void emitRecord(IssuanceSettings settings, SettlementAction action, AccountId participant,
                            BigInteger amount, SettlementJournal journal) {
        byte[] encoded = SettlementRecordCodec.encode(new SettlementRecord(action, participant, amount));
        BridgeGateway bridge = configService.resolveBridge(settings);
        journal.afterCommit(() -> bridge.sendMessage(encoded));
    }

    private List<RedemptionRequest> drainInternal(IssuanceSettings settings, SettlementJournal journal) {
        return processQueue(null, settings, journal).getPayouts();
    }

    /**
     * 큐 처리 후 지급 실행 (큐 복원은 지급 보상보다 나중에 실행되도록 먼저 기록)
     */
    private QueueProcessResult processQueue(RedemptionRequest newRequest, IssuanceSettings settings,
                                            SettlementJournal journal) {
        BigInteger available = reserveAsset.balanceOf(custody);
        QueueProcessResult result = queue.process(newRequest, available, settings.getMaxBatch());
        journal.record("queue process", () -> queue.revert(result));

        for (RedemptionRequest payout : result.getPayouts()) {
            AccountId beneficiary = payout.getBeneficiary();
            BigInteger amount = payout.getAmount();
            reserveAsset.transfer(custody, beneficiary, amount);
            journal.record("payout " + amount + " to " + beneficiary,
                    () -> reserveAsset.transfer(beneficiary, custody, amount));
            journal.afterCommit(() -> auditService.record(AuditAction.PAYOUT, beneficiary, amount,
                    null, null, queue.length()));
            log.debug("[SettlementOrchestrator] 상환 지급: beneficiary={}, amount={}", beneficiary, amount);
        }
        return result;
    }

    private BigInteger forwardInternal(IssuanceSettings settings, SettlementJournal journal) {
        BigInteger localBalance = reserveAsset.balanceOf(custody);
        Optional<ForwardInstruction> instruction =
                liquidityController.evaluateForwarding(localBalance, settings.getLiquidityPolicy());
        if (instruction.isEmpty()) {
            return BigInteger.ZERO;
        }

        BridgeGateway bridge = configService.resolveBridge(settings);
        BigInteger amount = instruction.get().getAmount();
        liquidityController.forward(instruction.get(), custody, reserveAsset, bridge);

        journal.afterCommit(() -> auditService.record(AuditAction.FORWARD, bridge.account(), amount,
                null, null, queue.length()));
        log.info("[SettlementOrchestrator] 브릿지 전송: amount={}, localBalanceBefore={}", amount, localBalance);
        return amount;
    }

    private BigInteger fetchPrice(IssuanceSettings settings) {
        PriceOracle oracle = configService.resolveOracle(settings);
        try {
            return oracle.getPrice();
        } catch (IssuanceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw IssuanceException.externalCallFailure("Oracle call failed: " + e.getMessage(), e);
        }
    }

    private SettleResponse settleResponse(List<RedemptionRequest> payouts, BigInteger forwarded) {
        return SettleResponse.builder()
                .payouts(toPayoutResponses(payouts))
                .forwardedAmount(forwarded)
                .localBalance(reserveAsset.balanceOf(custody))
                .queueLength(queue.length())
                .build();
    }

    private static List<PayoutResponse> toPayoutResponses(List<RedemptionRequest> requests) {
        return requests.stream()
                .map(PayoutResponse::from)
                .collect(Collectors.toList());
    }

    private static void requireAccount(AccountId account, String name) {
        if (account == null || account.isZero()) {
            throw IssuanceException.invalidInput(name + " must be a non-zero account");
        }
    }
}
