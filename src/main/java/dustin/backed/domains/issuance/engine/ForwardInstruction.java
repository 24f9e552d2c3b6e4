package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;

/**
 * 브릿지 전송 지시
 * Forward Instruction
 *
 * amount = localBalance - bufferThreshold
 */
public final class ForwardInstruction {

    private final BigInteger amount;

    public ForwardInstruction(BigInteger amount) {
        this.amount = FixedPoint.requirePositive(amount, "forward amount");
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public String toString() {
        return "ForwardInstruction{amount=" + amount + "}";
    }
}
