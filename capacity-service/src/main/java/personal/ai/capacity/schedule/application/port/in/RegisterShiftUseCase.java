package personal.ai.capacity.schedule.application.port.in;

import personal.ai.capacity.schedule.domain.model.Shift;

/**
 * Register Shift UseCase (Input Port)
 */
public interface RegisterShiftUseCase {

    Shift registerShift(RegisterShiftCommand command);
}
