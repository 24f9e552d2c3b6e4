package dustin.backed.domains.issuance.model.entity;

import java.math.BigInteger;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 발행 설정 엔티티
 * Issuance Config Entity
 *
 * 역할:
 * - 설정 권한자가 변경하는 단일 쓰기 필드 (스프레드, 수수료, 임계값, 계정, 오라클/브릿지 선택)
 * - 단일 행 (id = 1), 서버 시작 시 메모리에 로드되어 사용
 *
 * 금액/비율 컬럼: NUMERIC(78, 0) (uint256 범위)
 */
@Entity
@Table(name = "issuance_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssuanceConfig {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    /**
     * 매수 스프레드 (스케일 10^18)
     */
    @Column(name = "buy_spread", nullable = false, precision = 78, scale = 0)
    private BigInteger buySpread;

    /**
     * 상환 스프레드 (스케일 10^18, 10^18 미만)
     */
    @Column(name = "redeem_spread", nullable = false, precision = 78, scale = 0)
    private BigInteger redeemSpread;

    @Column(name = "buy_fee", nullable = false, precision = 78, scale = 0)
    private BigInteger buyFee;

    @Column(name = "redeem_fee", nullable = false, precision = 78, scale = 0)
    private BigInteger redeemFee;

    @Column(name = "buffer_threshold", nullable = false, precision = 78, scale = 0)
    private BigInteger bufferThreshold;

    @Column(name = "min_bridge_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger minBridgeAmount;

    @Column(name = "max_batch", nullable = false)
    private Integer maxBatch;

    @Column(name = "oracle_name", nullable = false, length = 100)
    private String oracleName;

    @Column(name = "bridge_name", nullable = false, length = 100)
    private String bridgeName;

    @Column(name = "fee_collector", nullable = false, length = 42)
    private String feeCollector;

    @Column(name = "operator_account", nullable = false, length = 42)
    private String operatorAccount;

    @Column(name = "owner_account", nullable = false, length = 42)
    private String ownerAccount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
