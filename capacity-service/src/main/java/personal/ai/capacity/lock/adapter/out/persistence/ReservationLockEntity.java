package personal.ai.capacity.lock.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import personal.ai.capacity.lock.domain.model.ReservationLock;

import java.time.Instant;
import java.util.UUID;

/**
 * Reservation Lock JPA Entity
 * 예약 홀드 테이블 매핑
 */
@Entity
@Table(name = "reservation_locks",
        indexes = {
                @Index(name = "idx_locks_slot_expires", columnList = "slot_id, expires_at"),
                @Index(name = "idx_locks_expires", columnList = "expires_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationLockEntity {

    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(length = 36)
    private UUID id;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    @Column(name = "holder_id", nullable = false, length = 128)
    private String holderId;

    @Column(nullable = false)
    private int quantity;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public static ReservationLockEntity fromDomain(ReservationLock lock) {
        ReservationLockEntity entity = new ReservationLockEntity();
        entity.id = lock.id();
        entity.slotId = lock.slotId();
        entity.holderId = lock.holderId();
        entity.quantity = lock.quantity();
        entity.createdAt = lock.createdAt();
        entity.expiresAt = lock.expiresAt();
        return entity;
    }

    public ReservationLock toDomain() {
        return new ReservationLock(id, slotId, holderId, quantity, createdAt, expiresAt);
    }
}
