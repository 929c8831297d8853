package personal.ai.capacity.reconciliation.domain.model;

/**
 * Capacity Correction
 * 보정으로 값이 바뀐 슬롯 한 건의 변경 내역
 *
 * @param overbooked 소비 예약 합계가 총 용량을 넘어 committed = total 로 고정된 경우
 */
public record CapacityCorrection(
        Long slotId,
        int oldAvailable,
        int newAvailable,
        int oldCommitted,
        int newCommitted,
        boolean overbooked
) {}
