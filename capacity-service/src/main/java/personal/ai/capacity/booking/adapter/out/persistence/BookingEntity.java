package personal.ai.capacity.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.capacity.booking.domain.model.Booking;
import personal.ai.capacity.booking.domain.model.BookingStatus;

import java.time.Instant;

/**
 * Booking JPA Entity
 * 예약 테이블 매핑
 */
@Entity
@Table(name = "bookings",
        indexes = {
                @Index(name = "idx_bookings_slot_status", columnList = "slot_id, status")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    @Column(nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "holder_id", length = 128)
    private String holderId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.slotId = booking.slotId();
        entity.quantity = booking.quantity();
        entity.status = booking.status();
        entity.holderId = booking.holderId();
        entity.createdAt = booking.createdAt();
        entity.updatedAt = booking.updatedAt();
        return entity;
    }

    public Booking toDomain() {
        return new Booking(id, slotId, quantity, status, holderId, createdAt, updatedAt);
    }
}
