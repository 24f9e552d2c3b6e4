package dustin.backed.domains.ledger;

import java.math.BigInteger;

import dustin.backed.domains.issuance.model.AccountId;

/**
 * 준비자산 원장
 * Reserve Asset Ledger
 *
 * 발행 엔진 외부의 협력자. 표준 대체 가능 토큰 회계
 * (잔고, 이체, 승인 기반 위임 이체)를 제공합니다.
 *
 * 모든 메서드는 성공하거나 상태 변경 없이 예외를 던집니다.
 */
public interface ReserveAsset {

    /**
     * 자산 식별자 (브릿지 전송 시 사용)
     */
    String assetId();

    BigInteger balanceOf(AccountId account);

    /**
     * from → to 이체
     *
     * @throws dustin.backed.domains.issuance.exception.IssuanceException 잔고 부족 시
     */
    void transfer(AccountId from, AccountId to, BigInteger amount);

    /**
     * spender가 승인받은 한도 내에서 from → to 이체
     *
     * @throws dustin.backed.domains.issuance.exception.IssuanceException 잔고 또는 승인 한도 부족 시
     */
    void transferFrom(AccountId spender, AccountId from, AccountId to, BigInteger amount);

    /**
     * owner가 spender에게 amount만큼 위임 (기존 한도를 덮어씀)
     */
    void approve(AccountId owner, AccountId spender, BigInteger amount);

    BigInteger allowance(AccountId owner, AccountId spender);

    /**
     * 신규 발행 (테스트/개발용 faucet)
     */
    void mint(AccountId to, BigInteger amount);
}
