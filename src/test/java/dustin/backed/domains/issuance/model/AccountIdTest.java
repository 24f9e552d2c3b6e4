package dustin.backed.domains.issuance.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dustin.backed.domains.issuance.exception.IssuanceException;

class AccountIdTest {

    @Test
    @DisplayName("대소문자 무관하게 파싱, 출력은 소문자")
    void normalizesToLowerCase() {
        AccountId upper = AccountId.of("0x00000000000000000000000000000000000000AB");
        AccountId lower = AccountId.of("0x00000000000000000000000000000000000000ab");

        assertThat(upper).isEqualTo(lower);
        assertThat(upper.toHex()).isEqualTo("0x00000000000000000000000000000000000000ab");
        assertThat(upper.hashCode()).isEqualTo(lower.hashCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0x", "00000000000000000000000000000000000000ab",
            "0x000000000000000000000000000000000000000g", "0x0000000000000000000000000000000000000000ab"})
    @DisplayName("잘못된 형식은 INVALID_INPUT")
    void rejectsMalformedHex(String hex) {
        assertThatThrownBy(() -> AccountId.of(hex)).isInstanceOf(IssuanceException.class);
    }

    @Test
    @DisplayName("ZERO 판별, 바이트 배열은 복사본으로 주고받음")
    void zeroCheckAndByteCopies() {
        assertThat(AccountId.ZERO.isZero()).isTrue();
        assertThat(AccountId.of("0x0000000000000000000000000000000000000001").isZero()).isFalse();

        byte[] raw = new byte[AccountId.LENGTH];
        raw[19] = 5;
        AccountId account = AccountId.fromBytes(raw);
        raw[19] = 6;
        account.toBytes()[19] = 7;

        assertThat(account.toBytes()[19]).isEqualTo((byte) 5);
    }

    @Test
    @DisplayName("부호 없는 바이트 순서로 비교")
    void comparesUnsigned() {
        AccountId low = AccountId.of("0x0000000000000000000000000000000000000001");
        AccountId high = AccountId.of("0xff00000000000000000000000000000000000000");

        assertThat(low).isLessThan(high);
    }
}
