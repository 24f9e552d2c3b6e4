package dustin.backed.domains.issuance.service;

import dustin.backed.domains.issuance.engine.LiquidityPolicy;
import dustin.backed.domains.issuance.engine.PricingParameters;
import dustin.backed.domains.issuance.model.AccountId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 발행 설정 스냅샷 (불변)
 * Issuance settings snapshot
 *
 * 설정 변경 시 새 인스턴스로 통째로 교체됩니다.
 * 정산 호출 하나는 처음 읽은 스냅샷 하나만 사용합니다.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public final class IssuanceSettings {

    private final PricingParameters pricing;

    private final LiquidityPolicy liquidityPolicy;

    private final int maxBatch;

    private final String oracleName;

    private final String bridgeName;

    private final AccountId feeCollector;

    private final AccountId operator;

    private final AccountId owner;

    public boolean isOwner(AccountId account) {
        return owner.equals(account);
    }

    public boolean isOwnerOrOperator(AccountId account) {
        return owner.equals(account) || operator.equals(account);
    }
}
