package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;
import java.util.Objects;

import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;

/**
 * 상환 요청 (지급 대기 의무)
 * Redemption Request
 *
 * 생성 후 불변. 지급되어야만 큐에서 제거됩니다.
 * 상태 전이: Created → Queued → Paid, 또는 Created → Paid
 */
public final class RedemptionRequest {

    private final AccountId beneficiary;
    private final BigInteger amount;

    /**
     * @throws IssuanceException 수혜자가 없거나 0 계정, 또는 수량이 0 이하인 경우
     */
    public RedemptionRequest(AccountId beneficiary, BigInteger amount) {
        if (beneficiary == null || beneficiary.isZero()) {
            throw IssuanceException.invalidInput("Redemption beneficiary is required");
        }
        this.beneficiary = beneficiary;
        this.amount = FixedPoint.requirePositive(amount, "redemption amount");
    }

    public AccountId getBeneficiary() {
        return beneficiary;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RedemptionRequest that = (RedemptionRequest) o;
        return beneficiary.equals(that.beneficiary) && amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(beneficiary, amount);
    }

    @Override
    public String toString() {
        return "RedemptionRequest{beneficiary=" + beneficiary + ", amount=" + amount + "}";
    }
}
