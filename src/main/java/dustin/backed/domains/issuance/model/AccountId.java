package dustin.backed.domains.issuance.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * 계정 식별자 (20바이트)
 * Account identifier
 *
 * 표현: "0x" + 40자리 16진수 (입력은 대소문자 무관, 출력은 소문자)
 *
 * 예시:
 * <pre>
 * AccountId user = AccountId.of("0x00000000000000000000000000000000000000a1");
 * </pre>
 */
public final class AccountId {

    public static final int LENGTH = 20;

    public static final AccountId ZERO = new AccountId(new byte[LENGTH]);

    private static final Pattern HEX_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private AccountId(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * 16진수 문자열로 생성
     *
     * @throws IssuanceException 형식이 잘못된 경우 (INVALID_INPUT)
     */
    @JsonCreator
    public static AccountId of(String hex) {
        if (hex == null || !HEX_PATTERN.matcher(hex).matches()) {
            throw IssuanceException.invalidInput("Invalid account id: " + hex);
        }
        return new AccountId(HEX.parseHex(hex.substring(2)));
    }

    /**
     * 20바이트 배열로 생성 (복사)
     */
    public static AccountId fromBytes(byte[] raw) {
        if (raw == null || raw.length != LENGTH) {
            throw IssuanceException.invalidInput("Account id must be " + LENGTH + " bytes");
        }
        return new AccountId(raw.clone());
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @JsonValue
    public String toHex() {
        return "0x" + HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((AccountId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
