package dustin.backed.domains.ledger;

import java.math.BigInteger;

import dustin.backed.domains.issuance.model.AccountId;

/**
 * 합성 토큰 원장
 * Synthetic Token Ledger
 *
 * 불변식: sum(balances) == totalSupply == 총 발행량 - 총 소각량
 */
public interface SyntheticTokenLedger {

    void mint(AccountId to, BigInteger amount);

    /**
     * @throws dustin.backed.domains.issuance.exception.IssuanceException 보유량 부족 시 (INSUFFICIENT_BALANCE)
     */
    void burn(AccountId from, BigInteger amount);

    BigInteger balanceOf(AccountId account);

    BigInteger totalSupply();
}
