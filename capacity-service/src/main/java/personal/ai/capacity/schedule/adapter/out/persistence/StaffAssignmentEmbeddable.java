package personal.ai.capacity.schedule.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.capacity.schedule.domain.model.StaffAssignment;

/**
 * 담당자 배정 (shift_assignments 컬렉션 테이블 행)
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaffAssignmentEmbeddable {

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Column(name = "duration_override_minutes")
    private Integer unitDurationMinutes;

    @Column(name = "capacity_override")
    private Integer capacityPerSlot;

    static StaffAssignmentEmbeddable fromDomain(StaffAssignment assignment) {
        StaffAssignmentEmbeddable embeddable = new StaffAssignmentEmbeddable();
        embeddable.staffId = assignment.staffId();
        embeddable.unitDurationMinutes = assignment.unitDurationMinutes();
        embeddable.capacityPerSlot = assignment.capacityPerSlot();
        return embeddable;
    }

    StaffAssignment toDomain() {
        return new StaffAssignment(staffId, unitDurationMinutes, capacityPerSlot);
    }
}
