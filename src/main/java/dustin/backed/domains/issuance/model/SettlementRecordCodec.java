// =====================================================
// SettlementRecordCodec - 정산 기록 바이너리 인코딩
// =====================================================
// 와이어 포맷 (총 53바이트, 필드 순서/폭 고정):
//
//   offset  size  field
//   0       1     action tag (BUY=0, REDEEM=1)
//   1       20    participant account id
//   21      32    amount (uint256, big-endian, 앞쪽 0 패딩)
//
// 순서와 폭은 고정 (오프체인 소비자가 이 레이아웃으로 디코딩)
// =====================================================

package dustin.backed.domains.issuance.model;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * 정산 기록 코덱
 * Settlement Record Codec
 */
public final class SettlementRecordCodec {

    public static final int AMOUNT_LENGTH = 32;

    public static final int ENCODED_LENGTH = 1 + AccountId.LENGTH + AMOUNT_LENGTH;

    private SettlementRecordCodec() {
    }

    public static byte[] encode(SettlementRecord record) {
        ByteBuffer buffer = ByteBuffer.allocate(ENCODED_LENGTH);
        buffer.put(record.getAction().getTag());
        buffer.put(record.getParticipant().toBytes());
        buffer.put(toUint256(record.getAmount()));
        return buffer.array();
    }

    /**
     * @throws IssuanceException 길이가 53바이트가 아니거나 태그를 알 수 없는 경우
     */
    public static SettlementRecord decode(byte[] encoded) {
        if (encoded == null || encoded.length != ENCODED_LENGTH) {
            throw IssuanceException.invalidInput("Settlement record must be " + ENCODED_LENGTH + " bytes");
        }
        SettlementAction action = SettlementAction.fromTag(encoded[0]);
        AccountId participant = AccountId.fromBytes(Arrays.copyOfRange(encoded, 1, 1 + AccountId.LENGTH));
        BigInteger amount = new BigInteger(1, Arrays.copyOfRange(encoded, 1 + AccountId.LENGTH, ENCODED_LENGTH));
        return new SettlementRecord(action, participant, amount);
    }

    /**
     * 32바이트 big-endian 부호 없는 정수
     */
    static byte[] toUint256(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] out = new byte[AMOUNT_LENGTH];
        // toByteArray()는 부호 비트용 0x00을 앞에 붙일 수 있음
        int start = raw.length > AMOUNT_LENGTH ? raw.length - AMOUNT_LENGTH : 0;
        int length = raw.length - start;
        System.arraycopy(raw, start, out, AMOUNT_LENGTH - length, length);
        return out;
    }
}
