package dustin.backed.domains.issuance.model;

import dustin.backed.domains.issuance.exception.IssuanceException;

/**
 * 정산 기록 액션 태그
 * Settlement record action tag
 *
 * 와이어 포맷의 태그 바이트 값은 변경 불가 (오프체인 소비자 호환)
 */
public enum SettlementAction {
    BUY((byte) 0),
    REDEEM((byte) 1);

    private final byte tag;

    SettlementAction(byte tag) {
        this.tag = tag;
    }

    public byte getTag() {
        return tag;
    }

    public static SettlementAction fromTag(byte tag) {
        for (SettlementAction action : values()) {
            if (action.tag == tag) {
                return action;
            }
        }
        throw IssuanceException.invalidInput("Unknown settlement action tag: " + tag);
    }
}
