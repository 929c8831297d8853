package personal.ai.capacity.booking.domain.model;

/**
 * Booking Status Enum
 * 예약 상태 (용량 소비 여부 포함)
 */
public enum BookingStatus {
    /**
     * 접수 (확정 대기)
     */
    PENDING(true),

    /**
     * 확정
     */
    CONFIRMED(true),

    /**
     * 방문 체크인
     */
    CHECKED_IN(true),

    /**
     * 이용 완료
     */
    COMPLETED(true),

    /**
     * 취소 (용량 반환)
     */
    CANCELLED(false);

    private final boolean consumesCapacity;

    BookingStatus(boolean consumesCapacity) {
        this.consumesCapacity = consumesCapacity;
    }

    public boolean consumesCapacity() {
        return consumesCapacity;
    }
}
