// =====================================================
// InMemoryReserveAsset - 메모리 기반 준비자산 원장
// =====================================================
// 역할: 준비자산 잔고와 위임 한도를 메모리에서 관리
//
// 자료구조:
// 1. HashMap<AccountId, BigInteger> balances
// 2. HashMap<AllowanceKey, BigInteger> allowances
//    - AllowanceKey: (owner, spender) 튜플
//
// 모든 public 메서드는 synchronized (외부 호출자가 여럿일 수 있음)
// 검증 후 변경: 예외 발생 시 상태는 그대로
// =====================================================

package dustin.backed.domains.ledger;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Objects;

import dustin.backed.domains.issuance.engine.FixedPoint;
import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;

/**
 * 위임 한도 키
 * (owner, spender) 튜플
 */
class AllowanceKey {
    private final AccountId owner;
    private final AccountId spender;

    AllowanceKey(AccountId owner, AccountId spender) {
        this.owner = owner;
        this.spender = spender;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AllowanceKey that = (AllowanceKey) o;
        return owner.equals(that.owner) && spender.equals(that.spender);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, spender);
    }
}

/**
 * 메모리 기반 준비자산 원장
 * In-memory reserve asset ledger
 */
public class InMemoryReserveAsset implements ReserveAsset {

    private final String assetId;

    private final HashMap<AccountId, BigInteger> balances = new HashMap<>();

    private final HashMap<AllowanceKey, BigInteger> allowances = new HashMap<>();

    public InMemoryReserveAsset(String assetId) {
        this.assetId = assetId;
    }

    @Override
    public String assetId() {
        return assetId;
    }

    @Override
    public synchronized BigInteger balanceOf(AccountId account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized void transfer(AccountId from, AccountId to, BigInteger amount) {
        FixedPoint.requireUint256(amount, "transfer amount");
        move(from, to, amount);
    }

    @Override
    public synchronized void transferFrom(AccountId spender, AccountId from, AccountId to, BigInteger amount) {
        FixedPoint.requireUint256(amount, "transfer amount");
        AllowanceKey key = new AllowanceKey(from, spender);
        BigInteger allowed = allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowed.compareTo(amount) < 0) {
            throw IssuanceException.insufficientBalance(
                    String.format("Insufficient allowance: owner=%s, spender=%s, required=%s, allowed=%s",
                            from, spender, amount, allowed));
        }
        move(from, to, amount);
        putOrRemove(allowances, key, allowed.subtract(amount));
    }

    @Override
    public synchronized void approve(AccountId owner, AccountId spender, BigInteger amount) {
        FixedPoint.requireUint256(amount, "allowance");
        putOrRemove(allowances, new AllowanceKey(owner, spender), amount);
    }

    @Override
    public synchronized BigInteger allowance(AccountId owner, AccountId spender) {
        return allowances.getOrDefault(new AllowanceKey(owner, spender), BigInteger.ZERO);
    }

    @Override
    public synchronized void mint(AccountId to, BigInteger amount) {
        FixedPoint.requireUint256(amount, "mint amount");
        BigInteger updated = balanceOf(to).add(amount);
        FixedPoint.requireUint256(updated, "balance");
        putOrRemove(balances, to, updated);
    }

    /**
     * 잔고 이동 (호출자가 락 보유)
     */
    protected void move(AccountId from, AccountId to, BigInteger amount) {
        BigInteger fromBalance = balanceOf(from);
        if (fromBalance.compareTo(amount) < 0) {
            throw IssuanceException.insufficientBalance(
                    String.format("Insufficient reserve balance: account=%s, required=%s, available=%s",
                            from, amount, fromBalance));
        }
        putOrRemove(balances, from, fromBalance.subtract(amount));
        putOrRemove(balances, to, balanceOf(to).add(amount));
    }

    private static <K> void putOrRemove(HashMap<K, BigInteger> map, K key, BigInteger value) {
        if (value.signum() == 0) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
    }
}
