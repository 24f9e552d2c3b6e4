package dustin.backed.domains.issuance.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import dustin.backed.domains.issuance.exception.IssuanceErrorCode;
import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;

/**
 * 상환 큐 테스트
 * 두 저장소(INDEXED, COMPACTING)에서 같은 동작을 보이는지 함께 검증
 *
 * 검증 항목:
 * - FIFO 순서, head-of-line 차단 (뒤 요청이 앞지르지 않음)
 * - maxBatch 상한
 * - 유동성 보존 (지급 합계 + 잔여 = 입력 유동성)
 * - 신규 요청 승인 제어 (큐가 비고 유동성이 충분할 때만 즉시 지급)
 * - revert로 process 1회 되돌리기
 */
class RedemptionQueueTest {

    private static final AccountId ALICE = AccountId.of("0x00000000000000000000000000000000000000a1");
    private static final AccountId BOB = AccountId.of("0x00000000000000000000000000000000000000b0");
    private static final AccountId CAROL = AccountId.of("0x00000000000000000000000000000000000000c1");

    private static RedemptionRequest request(AccountId beneficiary, long amount) {
        return new RedemptionRequest(beneficiary, BigInteger.valueOf(amount));
    }

    private static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }

    /**
     * 유동성 0으로 요청을 넣어 큐에 쌓기
     */
    private static void enqueue(RedemptionQueue queue, RedemptionRequest... requests) {
        for (RedemptionRequest r : requests) {
            QueueProcessResult result = queue.process(r, BigInteger.ZERO, 10);
            assertThat(result.isNewRequestQueued()).isTrue();
        }
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("큐에 쌓인 요청은 FIFO 순서로 지급")
    void paysInFifoOrder(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        enqueue(queue, request(ALICE, 10), request(BOB, 20), request(CAROL, 30));

        QueueProcessResult result = queue.process(amount(100), 10);

        assertThat(result.getPayouts()).containsExactly(request(ALICE, 10), request(BOB, 20), request(CAROL, 30));
        assertThat(result.getTotalPaid()).isEqualTo(amount(60));
        assertThat(result.getRemainingLiquidity()).isEqualTo(amount(40));
        assertThat(queue.length()).isZero();
        assertThat(queue.head()).isEqualTo(queue.tail());
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("맞지 않는 첫 요청에서 정지 (뒤의 작은 요청을 건너뛰어 지급하지 않음)")
    void headOfLineBlocks(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        enqueue(queue, request(ALICE, 50), request(BOB, 20));

        QueueProcessResult result = queue.process(amount(30), 10);

        assertThat(result.getPayouts()).isEmpty();
        assertThat(result.getRemainingLiquidity()).isEqualTo(amount(30));
        assertThat(queue.length()).isEqualTo(2);
        assertThat(queue.peek(0)).isEqualTo(request(ALICE, 50));
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("유동성이 순서대로 보충되면 [50, 20] 큐 길이가 2 → 1 → 0")
    void drainsAsLiquidityArrives(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        enqueue(queue, request(ALICE, 50), request(BOB, 20));

        queue.process(amount(40), 10);
        assertThat(queue.length()).isEqualTo(2);

        QueueProcessResult second = queue.process(amount(50), 10);
        assertThat(second.getPayouts()).containsExactly(request(ALICE, 50));
        assertThat(queue.length()).isEqualTo(1);

        QueueProcessResult third = queue.process(amount(20), 10);
        assertThat(third.getPayouts()).containsExactly(request(BOB, 20));
        assertThat(queue.length()).isZero();
        assertThat(queue.pendingTotal()).isEqualTo(BigInteger.ZERO);
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("한 번에 maxBatch 건까지만 지급")
    void respectsMaxBatch(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        for (int i = 0; i < 5; i++) {
            enqueue(queue, request(ALICE, 1));
        }

        QueueProcessResult result = queue.process(amount(100), 2);

        assertThat(result.getPayouts()).hasSize(2);
        assertThat(result.getDequeuedCount()).isEqualTo(2);
        assertThat(queue.length()).isEqualTo(3);
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("maxBatch를 다 쓰면 유동성이 있어도 신규 요청은 큐에 추가")
    void newRequestQueuedWhenBatchExhausted(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        enqueue(queue, request(ALICE, 5), request(BOB, 5));

        QueueProcessResult result = queue.process(request(CAROL, 5), amount(100), 2);

        assertThat(result.getPayouts()).containsExactly(request(ALICE, 5), request(BOB, 5));
        assertThat(result.isNewRequestPaid()).isFalse();
        assertThat(result.isNewRequestQueued()).isTrue();
        assertThat(queue.length()).isEqualTo(1);
        assertThat(queue.peek(0)).isEqualTo(request(CAROL, 5));
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("큐가 비어 있고 유동성이 충분하면 신규 요청은 즉시 지급 (큐에 추가되지 않음)")
    void newRequestPaidImmediatelyWhenLiquid(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());

        QueueProcessResult result = queue.process(request(ALICE, 25), amount(25), 10);

        assertThat(result.isNewRequestPaid()).isTrue();
        assertThat(result.getPayouts()).containsExactly(request(ALICE, 25));
        assertThat(result.getRemainingLiquidity()).isEqualTo(BigInteger.ZERO);
        assertThat(queue.length()).isZero();
        assertThat(queue.tail()).isZero();
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("앞선 요청이 막혀 있으면 신규 요청은 유동성이 있어도 대기")
    void newRequestWaitsBehindBlockedHead(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        enqueue(queue, request(ALICE, 50));

        QueueProcessResult result = queue.process(request(BOB, 10), amount(30), 10);

        assertThat(result.getPayouts()).isEmpty();
        assertThat(result.isNewRequestQueued()).isTrue();
        assertThat(queue.snapshot(10)).containsExactly(request(ALICE, 50), request(BOB, 10));
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("같은 호출에서 큐가 비워지면 남은 유동성으로 신규 요청도 지급 (큐 요청 먼저)")
    void newRequestPaidAfterQueueCleared(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        enqueue(queue, request(ALICE, 30));

        QueueProcessResult result = queue.process(request(BOB, 20), amount(60), 10);

        assertThat(result.getPayouts()).containsExactly(request(ALICE, 30), request(BOB, 20));
        assertThat(result.isNewRequestPaid()).isTrue();
        assertThat(result.getRemainingLiquidity()).isEqualTo(amount(10));
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("지급 합계 + 잔여 유동성 = 입력 유동성, 지급 합계는 입력을 넘지 않음")
    void conservesLiquidity(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        long[] amounts = {7, 3, 11, 2, 19, 5, 1, 8};
        for (long a : amounts) {
            enqueue(queue, request(ALICE, a));
        }

        BigInteger[] liquidity = {amount(9), amount(1), amount(30), amount(0), amount(100)};
        for (BigInteger available : liquidity) {
            QueueProcessResult result = queue.process(request(BOB, 4), available, 3);
            assertThat(result.getTotalPaid().add(result.getRemainingLiquidity())).isEqualTo(available);
            assertThat(result.getTotalPaid()).isLessThanOrEqualTo(available);
        }
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("pendingTotal은 대기 중인 요청 금액 합계와 같음")
    void tracksPendingTotal(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        enqueue(queue, request(ALICE, 50), request(BOB, 20), request(CAROL, 5));
        assertThat(queue.pendingTotal()).isEqualTo(amount(75));

        queue.process(amount(60), 10);

        assertThat(queue.pendingTotal()).isEqualTo(amount(25));
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("revert: 지급된 요청을 head에 되돌리고 추가된 신규 요청을 제거")
    void revertRestoresPreviousState(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());
        enqueue(queue, request(ALICE, 10), request(BOB, 20), request(CAROL, 100));
        long headBefore = queue.head();
        long tailBefore = queue.tail();
        List<RedemptionRequest> entriesBefore = queue.snapshot(10);

        QueueProcessResult result = queue.process(request(ALICE, 1), amount(50), 10);
        assertThat(result.getDequeuedCount()).isEqualTo(2);
        assertThat(result.isNewRequestQueued()).isTrue();

        queue.revert(result);

        assertThat(queue.head()).isEqualTo(headBefore);
        assertThat(queue.tail()).isEqualTo(tailBefore);
        assertThat(queue.snapshot(10)).isEqualTo(entriesBefore);
        assertThat(queue.pendingTotal()).isEqualTo(amount(130));
    }

    @Test
    @DisplayName("revert: 압축으로 잘려나간 구간도 복원 (COMPACTING)")
    void revertAfterCompaction() {
        CompactingQueueStorage storage = new CompactingQueueStorage();
        RedemptionQueue queue = new RedemptionQueue(storage);
        List<RedemptionRequest> queued = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            RedemptionRequest r = request(ALICE, i);
            queued.add(r);
            enqueue(queue, r);
        }

        // 1+2+3+4 = 10 → 4건 지급 → headOffset 4 > 6/2 → 압축
        QueueProcessResult result = queue.process(amount(10), 10);
        assertThat(result.getDequeuedCount()).isEqualTo(4);
        assertThat(storage.allocatedSlots()).isEqualTo(2);

        queue.revert(result);

        assertThat(queue.head()).isZero();
        assertThat(queue.tail()).isEqualTo(6);
        assertThat(queue.snapshot(10)).isEqualTo(queued);
    }

    @ParameterizedTest
    @EnumSource(QueueStorageType.class)
    @DisplayName("maxBatch < 1 또는 음수 유동성은 INVALID_INPUT")
    void rejectsInvalidArguments(QueueStorageType type) {
        RedemptionQueue queue = new RedemptionQueue(type.create());

        assertThatThrownBy(() -> queue.process(amount(10), 0))
                .isInstanceOf(IssuanceException.class)
                .extracting(e -> ((IssuanceException) e).getCode())
                .isEqualTo(IssuanceErrorCode.INVALID_INPUT);
        assertThatThrownBy(() -> queue.process(amount(-1), 1))
                .isInstanceOf(IssuanceException.class);
    }

    @Test
    @DisplayName("수혜자가 0 계정이거나 금액이 0 이하인 요청은 생성 불가")
    void rejectsInvalidRequest() {
        assertThatThrownBy(() -> new RedemptionRequest(AccountId.ZERO, amount(1)))
                .isInstanceOf(IssuanceException.class);
        assertThatThrownBy(() -> new RedemptionRequest(ALICE, BigInteger.ZERO))
                .isInstanceOf(IssuanceException.class);
        assertThatThrownBy(() -> new RedemptionRequest(null, amount(1)))
                .isInstanceOf(IssuanceException.class);
    }
}
