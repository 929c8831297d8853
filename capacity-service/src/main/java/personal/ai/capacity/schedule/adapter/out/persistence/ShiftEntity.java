package personal.ai.capacity.schedule.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.capacity.schedule.domain.model.Shift;
import personal.ai.capacity.schedule.domain.model.WeekdayMask;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Shift JPA Entity
 * 근무 일정 테이블 매핑 (요일은 7비트 마스크로 저장)
 */
@Entity
@Table(name = "shifts",
        indexes = {
                @Index(name = "idx_shifts_service", columnList = "service_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ShiftEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "days_of_week_mask", nullable = false)
    private int daysOfWeekMask;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "time_zone", nullable = false, length = 64)
    private String timeZone;

    @Column(name = "unit_duration_minutes", nullable = false)
    private int unitDurationMinutes;

    @Column(name = "capacity_per_slot", nullable = false)
    private int capacityPerSlot;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "shift_assignments", joinColumns = @JoinColumn(name = "shift_id"))
    @OrderColumn(name = "position")
    private List<StaffAssignmentEmbeddable> assignments = new ArrayList<>();

    public static ShiftEntity fromDomain(Shift shift) {
        ShiftEntity entity = new ShiftEntity();
        entity.id = shift.id();
        entity.tenantId = shift.tenantId();
        entity.serviceId = shift.serviceId();
        entity.daysOfWeekMask = WeekdayMask.encode(shift.daysOfWeek());
        entity.startTime = shift.startTime();
        entity.endTime = shift.endTime();
        entity.timeZone = shift.zoneId().getId();
        entity.unitDurationMinutes = shift.unitDurationMinutes();
        entity.capacityPerSlot = shift.capacityPerSlot();
        entity.assignments = new ArrayList<>(shift.assignments().stream()
                .map(StaffAssignmentEmbeddable::fromDomain)
                .toList());
        return entity;
    }

    public Shift toDomain() {
        return new Shift(
                id,
                tenantId,
                serviceId,
                WeekdayMask.decode(daysOfWeekMask),
                startTime,
                endTime,
                ZoneId.of(timeZone),
                unitDurationMinutes,
                capacityPerSlot,
                assignments.stream().map(StaffAssignmentEmbeddable::toDomain).toList()
        );
    }
}
