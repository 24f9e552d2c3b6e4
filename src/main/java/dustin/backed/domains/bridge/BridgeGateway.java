package dustin.backed.domains.bridge;

import java.math.BigInteger;

import dustin.backed.domains.issuance.model.AccountId;

/**
 * 브릿지 게이트웨이
 * Bridge Gateway
 *
 * 다른 실행 도메인으로 준비자산과 메시지를 보내는 외부 정산 채널입니다.
 */
public interface BridgeGateway {

    /**
     * 위임 이체를 소비하는 브릿지 계정 (approve 대상)
     */
    AccountId account();

    /**
     * sender가 미리 승인한 준비자산을 브릿지로 이체
     *
     * 원자적: 이체와 승인 소비가 함께 성공하거나 둘 다 일어나지 않음
     *
     * @param sender 승인한 계정 (발행자 보관 계정)
     * @param assetId 준비자산 식별자
     * @param amount 이체 금액
     * @throws dustin.backed.domains.issuance.exception.IssuanceException 실패 시 (EXTERNAL_CALL_FAILURE)
     */
    void sendStable(AccountId sender, String assetId, BigInteger amount);

    /**
     * 불투명 정산 기록 전달 (fire-and-forget, 반환값 없음)
     */
    void sendMessage(byte[] encodedRecord);
}
