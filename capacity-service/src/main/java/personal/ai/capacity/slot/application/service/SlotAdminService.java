package personal.ai.capacity.slot.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.capacity.slot.application.port.in.ChangeSlotOpenUseCase;
import personal.ai.capacity.slot.application.port.out.SlotRepository;
import personal.ai.capacity.slot.domain.exception.SlotNotFoundException;
import personal.ai.capacity.slot.domain.model.Slot;

/**
 * Slot Admin Service
 * 슬롯 오픈/마감 전환
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotAdminService implements ChangeSlotOpenUseCase {

    private final SlotRepository slotRepository;

    @Override
    @Transactional
    public Slot changeOpen(Long slotId, boolean open) {
        // 진행 중인 홀드/예약과 직렬화하기 위해 행 락 후 변경
        Slot slot = slotRepository.findByIdForUpdate(slotId)
                .orElseThrow(() -> new SlotNotFoundException(slotId));

        if (slot.open() == open) {
            return slot;
        }

        Slot saved = slotRepository.save(slot.withOpen(open));
        log.info("Slot open state changed: slotId={}, open={}", slotId, open);
        return saved;
    }
}
