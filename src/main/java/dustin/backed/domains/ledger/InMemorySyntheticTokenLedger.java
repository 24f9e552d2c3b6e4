package dustin.backed.domains.ledger;

import java.math.BigInteger;
import java.util.HashMap;

import dustin.backed.domains.issuance.engine.FixedPoint;
import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;

/**
 * 메모리 기반 합성 토큰 원장
 * In-memory synthetic token ledger
 */
public class InMemorySyntheticTokenLedger implements SyntheticTokenLedger {

    private final HashMap<AccountId, BigInteger> balances = new HashMap<>();

    private BigInteger totalSupply = BigInteger.ZERO;

    @Override
    public synchronized void mint(AccountId to, BigInteger amount) {
        FixedPoint.requireUint256(amount, "mint amount");
        BigInteger supply = FixedPoint.requireUint256(totalSupply.add(amount), "total supply");
        balances.put(to, balanceOf(to).add(amount));
        totalSupply = supply;
    }

    @Override
    public synchronized void burn(AccountId from, BigInteger amount) {
        FixedPoint.requireUint256(amount, "burn amount");
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw IssuanceException.insufficientBalance(
                    String.format("Insufficient token balance: account=%s, required=%s, available=%s",
                            from, amount, balance));
        }
        BigInteger updated = balance.subtract(amount);
        if (updated.signum() == 0) {
            balances.remove(from);
        } else {
            balances.put(from, updated);
        }
        totalSupply = totalSupply.subtract(amount);
    }

    @Override
    public synchronized BigInteger balanceOf(AccountId account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }
}
