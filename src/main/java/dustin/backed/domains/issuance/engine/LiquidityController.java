// =====================================================
// LiquidityController - 로컬 버퍼 / 브릿지 전송 제어
// =====================================================
// 역할: 로컬 준비자산이 버퍼 임계값 + 최소 전송량을 넘으면
//       임계값을 넘는 부분을 브릿지로 전송
//
// 판단 규칙:
//   localBalance > bufferThreshold + minBridgeAmount
//   → forward(localBalance - bufferThreshold)
//
// 전송은 2단계 (원자적):
// 1. approve(custody → bridge, amount)
// 2. bridge.sendStable(custody, asset, amount)
// → 2단계 실패 시 1단계 승인을 이전 값으로 되돌린 뒤 예외 전파
//
// 큐 정산이 전송보다 우선: 호출자는 큐 정산 후의 잔고로 평가해야 함
//
// 큐 head가 막혀 있어도 임계값 초과분은 전송됨:
//   임계값 0이면 막힌 head보다 작은 매수 대금은 바로 브릿지로 나가고,
//   큐는 버퍼 입금이나 head 이상인 단일 매수로만 줄어듦
//   → 운영자는 대기 중인 상환 규모에 맞춰 bufferThreshold를 설정
// =====================================================

package dustin.backed.domains.issuance.engine;

import java.math.BigInteger;
import java.util.Optional;

import dustin.backed.domains.bridge.BridgeGateway;
import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.ledger.ReserveAsset;

/**
 * 유동성 컨트롤러
 * Liquidity Controller
 */
public class LiquidityController {

    /**
     * 전송 여부 판단
     *
     * @param localBalance 큐 정산 이후의 로컬 잔고
     * @param policy 유동성 정책 스냅샷
     * @return 전송 지시, 전송할 필요 없으면 empty
     */
    public Optional<ForwardInstruction> evaluateForwarding(BigInteger localBalance, LiquidityPolicy policy) {
        FixedPoint.requireUint256(localBalance, "local balance");
        BigInteger trigger = policy.getBufferThreshold().add(policy.getMinBridgeAmount());
        if (localBalance.compareTo(trigger) <= 0) {
            return Optional.empty();
        }
        return Optional.of(new ForwardInstruction(localBalance.subtract(policy.getBufferThreshold())));
    }

    /**
     * 초과분 브릿지 전송 (승인 → 전송, 실패 시 승인 복원)
     *
     * @param instruction 전송 지시
     * @param custody 발행자 보관 계정
     * @param reserveAsset 준비자산 원장
     * @param bridge 브릿지 게이트웨이
     * @throws IssuanceException 브릿지 전송 실패 (EXTERNAL_CALL_FAILURE), 승인은 이미 복원된 상태
     */
    public void forward(ForwardInstruction instruction, AccountId custody, ReserveAsset reserveAsset,
                        BridgeGateway bridge) {
        AccountId spender = bridge.account();
        BigInteger amount = instruction.getAmount();
        BigInteger previousAllowance = reserveAsset.allowance(custody, spender);

        // 1. 전송 승인
        reserveAsset.approve(custody, spender, amount);

        // 2. 브릿지 전송
        try {
            bridge.sendStable(custody, reserveAsset.assetId(), amount);
        } catch (RuntimeException e) {
            reserveAsset.approve(custody, spender, previousAllowance);
            if (e instanceof IssuanceException) {
                throw e;
            }
            throw IssuanceException.externalCallFailure("Bridge transfer failed: " + e.getMessage(), e);
        }

        // 브릿지가 일부만 소비한 경우 남은 승인 제거
        if (reserveAsset.allowance(custody, spender).signum() != 0) {
            reserveAsset.approve(custody, spender, BigInteger.ZERO);
        }
    }
}
