package personal.ai.capacity.slot.application.port.in;

import personal.ai.capacity.slot.domain.model.Slot;

/**
 * Change Slot Open UseCase (Input Port)
 * 운영자의 슬롯 오픈/마감 전환 (카운터는 유지)
 */
public interface ChangeSlotOpenUseCase {

    Slot changeOpen(Long slotId, boolean open);
}
