package dustin.backed.domains.issuance.model;

import java.math.BigInteger;
import java.util.Objects;

import dustin.backed.domains.issuance.engine.FixedPoint;

/**
 * 정산 기록
 * Settlement Record
 *
 * 매수/상환마다 브릿지 메시지 채널로 전달되는 오프체인 회계용 기록입니다.
 * amount는 수수료를 뺀 순 준비자산 금액입니다.
 */
public final class SettlementRecord {

    private final SettlementAction action;
    private final AccountId participant;
    private final BigInteger amount;

    public SettlementRecord(SettlementAction action, AccountId participant, BigInteger amount) {
        this.action = Objects.requireNonNull(action, "action");
        this.participant = Objects.requireNonNull(participant, "participant");
        this.amount = FixedPoint.requireUint256(amount, "amount");
    }

    public SettlementAction getAction() {
        return action;
    }

    public AccountId getParticipant() {
        return participant;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SettlementRecord that = (SettlementRecord) o;
        return action == that.action && participant.equals(that.participant) && amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, participant, amount);
    }

    @Override
    public String toString() {
        return "SettlementRecord{action=" + action + ", participant=" + participant + ", amount=" + amount + "}";
    }
}
