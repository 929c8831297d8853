package personal.ai.capacity.schedule.application.port.in;

import personal.ai.capacity.schedule.domain.model.Shift;

/**
 * Get Shift UseCase (Input Port)
 */
public interface GetShiftUseCase {

    Shift getShift(Long shiftId);
}
