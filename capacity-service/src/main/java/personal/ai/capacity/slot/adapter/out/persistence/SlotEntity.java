package personal.ai.capacity.slot.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.capacity.slot.domain.model.Slot;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Slot JPA Entity
 * 슬롯 테이블 매핑
 */
@Entity
@Table(name = "slots",
        indexes = {
                @Index(name = "idx_slots_shift_date", columnList = "shift_id, slot_date"),
                @Index(name = "idx_slots_service_date", columnList = "service_id, slot_date")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SlotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "shift_id", nullable = false)
    private Long shiftId;

    @Column(name = "staff_id")
    private Long staffId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Column(name = "total_capacity", nullable = false)
    private int totalCapacity;

    @Column(name = "available_capacity", nullable = false)
    private int availableCapacity;

    @Column(name = "committed_count", nullable = false)
    private int committedCount;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    /**
     * 도메인 모델로부터 엔티티 생성 (신규/업데이트 공용)
     */
    public static SlotEntity fromDomain(Slot slot) {
        SlotEntity entity = new SlotEntity();
        entity.id = slot.id();
        entity.tenantId = slot.tenantId();
        entity.serviceId = slot.serviceId();
        entity.shiftId = slot.shiftId();
        entity.staffId = slot.staffId();
        entity.slotDate = slot.slotDate();
        entity.startTime = slot.startTime();
        entity.endTime = slot.endTime();
        entity.startsAt = slot.startsAt();
        entity.endsAt = slot.endsAt();
        entity.totalCapacity = slot.totalCapacity();
        entity.availableCapacity = slot.availableCapacity();
        entity.committedCount = slot.committedCount();
        entity.open = slot.open();
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Slot toDomain() {
        return new Slot(id, tenantId, serviceId, shiftId, staffId, slotDate, startTime, endTime,
                startsAt, endsAt, totalCapacity, availableCapacity, committedCount, open);
    }
}
