package dustin.backed.domains.issuance.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.backed.domains.issuance.exception.IssuanceErrorCode;
import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * 정산 기록 코덱 테스트
 *
 * 와이어 포맷: tag(1) + participant(20) + amount(32, big-endian) = 53바이트
 */
class SettlementRecordCodecTest {

    private static final AccountId HOLDER = AccountId.of("0x00000000000000000000000000000000000000a1");

    @Test
    @DisplayName("인코딩 결과는 53바이트, 필드 위치 고정")
    void encodesFixedLayout() {
        byte[] encoded = SettlementRecordCodec.encode(
                new SettlementRecord(SettlementAction.REDEEM, HOLDER, BigInteger.valueOf(0x0102)));

        assertThat(encoded).hasSize(53);
        assertThat(encoded[0]).isEqualTo((byte) 1);
        assertThat(encoded[20]).isEqualTo((byte) 0xa1);
        assertThat(encoded[51]).isEqualTo((byte) 0x01);
        assertThat(encoded[52]).isEqualTo((byte) 0x02);
        for (int i = 21; i < 51; i++) {
            assertThat(encoded[i]).isZero();
        }
    }

    @Test
    @DisplayName("BUY 태그는 0")
    void buyTagIsZero() {
        byte[] encoded = SettlementRecordCodec.encode(
                new SettlementRecord(SettlementAction.BUY, HOLDER, BigInteger.ONE));

        assertThat(encoded[0]).isZero();
    }

    @Test
    @DisplayName("uint256 최대값도 32바이트에 그대로 담김")
    void encodesMaxAmount() {
        BigInteger max = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
        SettlementRecord record = new SettlementRecord(SettlementAction.BUY, HOLDER, max);

        SettlementRecord decoded = SettlementRecordCodec.decode(SettlementRecordCodec.encode(record));

        assertThat(decoded).isEqualTo(record);
        assertThat(decoded.getAmount()).isEqualTo(max);
    }

    @Test
    @DisplayName("53바이트가 아니면 INVALID_INPUT")
    void rejectsWrongLength() {
        assertThatThrownBy(() -> SettlementRecordCodec.decode(new byte[52]))
                .isInstanceOf(IssuanceException.class)
                .extracting(e -> ((IssuanceException) e).getCode())
                .isEqualTo(IssuanceErrorCode.INVALID_INPUT);
        assertThatThrownBy(() -> SettlementRecordCodec.decode(null))
                .isInstanceOf(IssuanceException.class);
    }

    @Test
    @DisplayName("알 수 없는 태그는 거부")
    void rejectsUnknownTag() {
        byte[] encoded = new byte[SettlementRecordCodec.ENCODED_LENGTH];
        encoded[0] = 7;

        assertThatThrownBy(() -> SettlementRecordCodec.decode(encoded))
                .isInstanceOf(IssuanceException.class)
                .hasMessageContaining("tag");
    }

    @Test
    @DisplayName("음수 금액 기록은 생성 불가")
    void rejectsNegativeAmount() {
        assertThatThrownBy(() -> new SettlementRecord(SettlementAction.BUY, HOLDER, BigInteger.valueOf(-1)))
                .isInstanceOf(IssuanceException.class);
    }
}
