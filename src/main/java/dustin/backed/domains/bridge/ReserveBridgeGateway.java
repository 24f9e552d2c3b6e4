package dustin.backed.domains.bridge;

import java.math.BigInteger;

import dustin.backed.domains.issuance.exception.IssuanceException;
import dustin.backed.domains.issuance.model.AccountId;
import dustin.backed.domains.issuance.model.SettlementRecordCodec;
import dustin.backed.domains.ledger.ReserveAsset;
import lombok.extern.slf4j.Slf4j;

/**
 * 준비자산 원장 기반 브릿지 게이트웨이
 * Reserve-ledger bridge gateway
 *
 * 역할:
 * - sendStable: 승인된 준비자산을 발행자 보관 계정에서 브릿지 금고 계정으로 이동
 * - sendMessage: 정산 기록을 메시지 발행자(Kafka)로 전달
 *
 * 처리 흐름 (sendStable):
 * 1. 자산 식별자 확인
 * 2. transferFrom(bridge, sender → vault) 실행 (원장 수준에서 원자적)
 * 3. 실패 시 EXTERNAL_CALL_FAILURE로 변환
 */
@Slf4j
public class ReserveBridgeGateway implements BridgeGateway {

    private final ReserveAsset reserveAsset;
    private final AccountId bridgeAccount;
    private final AccountId vaultAccount;
    private final BridgeMessagePublisher messagePublisher;

    public ReserveBridgeGateway(ReserveAsset reserveAsset, AccountId bridgeAccount, AccountId vaultAccount,
                                BridgeMessagePublisher messagePublisher) {
        this.reserveAsset = reserveAsset;
        this.bridgeAccount = bridgeAccount;
        this.vaultAccount = vaultAccount;
        this.messagePublisher = messagePublisher;
    }

    @Override
    public AccountId account() {
        return bridgeAccount;
    }

    @Override
    public void sendStable(AccountId sender, String assetId, BigInteger amount) {
        if (!reserveAsset.assetId().equals(assetId)) {
            throw IssuanceException.externalCallFailure(
                    "Bridge does not support asset " + assetId + " (expected " + reserveAsset.assetId() + ")", null);
        }
        try {
            reserveAsset.transferFrom(bridgeAccount, sender, vaultAccount, amount);
        } catch (IssuanceException e) {
            log.error("[ReserveBridgeGateway] 준비자산 브릿지 전송 실패: sender={}, amount={}, error={}",
                    sender, amount, e.getMessage());
            throw IssuanceException.externalCallFailure("Bridge transfer rejected: " + e.getMessage(), e);
        }
        log.info("[ReserveBridgeGateway] 준비자산 브릿지 전송: asset={}, sender={}, vault={}, amount={}",
                assetId, sender, vaultAccount, amount);
    }

    @Override
    public void sendMessage(byte[] encodedRecord) {
        try {
            String key = SettlementRecordCodec.decode(encodedRecord).getParticipant().toHex();
            messagePublisher.publish(key, encodedRecord);
        } catch (RuntimeException e) {
            // 전달 보장은 브릿지 책임 (fire-and-forget)
            log.error("[ReserveBridgeGateway] 정산 메시지 전달 실패: length={}, error={}",
                    encodedRecord == null ? 0 : encodedRecord.length, e.getMessage());
        }
    }

    /**
     * 브릿지로 넘어간 준비자산 총액
     */
    public BigInteger bridgedBalance() {
        return reserveAsset.balanceOf(vaultAccount);
    }
}
