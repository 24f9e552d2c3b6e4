// =====================================================
// RedemptionQueueBenchmark - 상환 큐 처리량 벤치마크
// =====================================================
// 역할: 저장소 구현(INDEXED / COMPACTING)별 큐 처리 비용 측정
//
// 측정 항목:
// 1. enqueueAndDrain: 유동성 0에서 N건 대기 → maxBatch 단위로 전부 지급
// 2. blockedHeadProcess: 선두가 막힌 큐에 처리 호출 반복 (매 호출 즉시 반환)
// 3. quoteAndConvert: 매수/상환 견적 + 수량 변환 (10^18 고정소수점)
//
// JMH 설정:
// - Warmup: 3 iterations, 2 seconds each
// - Measurement: 3 iterations, 2 seconds each
// - Fork: 1
// - Mode: Average Time
// =====================================================

package dustin.backed.benchmarks;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import dustin.backed.domains.issuance.engine.FixedPoint;
import dustin.backed.domains.issuance.engine.PricingEngine;
import dustin.backed.domains.issuance.engine.PricingParameters;
import dustin.backed.domains.issuance.engine.QueueStorageType;
import dustin.backed.domains.issuance.engine.Quote;
import dustin.backed.domains.issuance.engine.RedemptionQueue;
import dustin.backed.domains.issuance.engine.RedemptionRequest;
import dustin.backed.domains.issuance.model.AccountId;

/**
 * 상환 큐 벤치마크
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
public class RedemptionQueueBenchmark {

    private static final int NUM_TEST_USERS = 100;
    private static final int MAX_BATCH = 50;
    private static final BigInteger REQUEST_AMOUNT = BigInteger.valueOf(1_000_000L);

    /**
     * 대기 요청 수
     */
    @Param({"1000", "10000", "50000"})
    public int requestCount;

    @Param({"INDEXED", "COMPACTING"})
    public QueueStorageType storage;

    private AccountId[] users;
    private RedemptionRequest[] requests;
    private RedemptionQueue blockedQueue;
    private PricingEngine pricingEngine;
    private PricingParameters pricing;

    @Setup(Level.Trial)
    public void setup() {
        users = new AccountId[NUM_TEST_USERS];
        for (int i = 0; i < NUM_TEST_USERS; i++) {
            users[i] = AccountId.of(String.format("0x%040x", i + 1));
        }
        requests = new RedemptionRequest[requestCount];
        for (int idx = 0; idx < requestCount; idx++) {
            requests[idx] = new RedemptionRequest(users[idx % NUM_TEST_USERS], REQUEST_AMOUNT);
        }

        // 선두 요청이 매우 커서 항상 막혀 있는 큐
        blockedQueue = new RedemptionQueue(storage.create());
        blockedQueue.process(new RedemptionRequest(users[0], REQUEST_AMOUNT.multiply(BigInteger.valueOf(requestCount))),
                BigInteger.ZERO, MAX_BATCH);
        for (RedemptionRequest request : requests) {
            blockedQueue.process(request, BigInteger.ZERO, MAX_BATCH);
        }

        pricingEngine = new PricingEngine();
        pricing = new PricingParameters(BigInteger.TEN.pow(15), BigInteger.TEN.pow(15),
                BigInteger.valueOf(1000), BigInteger.valueOf(1000));
    }

    /**
     * N건 대기 후 maxBatch 단위로 전부 지급
     */
    @Benchmark
    public void enqueueAndDrain(Blackhole bh) {
        RedemptionQueue queue = new RedemptionQueue(storage.create());
        for (RedemptionRequest request : requests) {
            bh.consume(queue.process(request, BigInteger.ZERO, MAX_BATCH));
        }

        BigInteger liquidity = REQUEST_AMOUNT.multiply(BigInteger.valueOf(requestCount));
        while (!queue.isEmpty()) {
            liquidity = queue.process(liquidity, MAX_BATCH).getRemainingLiquidity();
        }
        bh.consume(liquidity);
        bh.consume(queue.allocatedSlots());
    }

    /**
     * 선두가 막힌 큐: 대기 건수와 무관하게 즉시 반환되어야 함
     */
    @Benchmark
    public void blockedHeadProcess(Blackhole bh) {
        bh.consume(blockedQueue.process(REQUEST_AMOUNT, MAX_BATCH));
    }

    /**
     * 견적 + 수량 변환
     */
    @Benchmark
    public void quoteAndConvert(Blackhole bh) {
        for (int idx = 0; idx < requestCount; idx++) {
            BigInteger basePrice = FixedPoint.SCALE.add(BigInteger.valueOf(idx));
            Quote buy = pricingEngine.buyQuote(basePrice, pricing);
            Quote redeem = pricingEngine.redeemQuote(basePrice, pricing);
            BigInteger tokens = pricingEngine.tokensForReserve(REQUEST_AMOUNT, buy.getExecPrice());
            bh.consume(pricingEngine.reserveForTokens(tokens, redeem.getExecPrice()));
        }
    }

    /**
     * 메인 메서드 (직접 실행 가능)
     */
    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
            .include(RedemptionQueueBenchmark.class.getSimpleName())
            .build();

        new Runner(opt).run();
    }
}
