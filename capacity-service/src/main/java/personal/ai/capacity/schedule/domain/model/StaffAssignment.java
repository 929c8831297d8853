package personal.ai.capacity.schedule.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Staff Assignment
 * 근무 일정에 배정된 담당자와 개별 설정 (미지정 값은 근무 일정 기본값 사용)
 */
public record StaffAssignment(
        Long staffId,
        Integer unitDurationMinutes,
        Integer capacityPerSlot
) {
    public StaffAssignment {
        if (staffId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff ID cannot be null");
        }
        if (unitDurationMinutes != null && unitDurationMinutes < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duration override must be positive");
        }
        if (capacityPerSlot != null && capacityPerSlot < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Capacity override must be positive");
        }
    }
}
