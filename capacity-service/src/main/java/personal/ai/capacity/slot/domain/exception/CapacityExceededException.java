package personal.ai.capacity.slot.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.util.Map;

/**
 * Capacity Exceeded Exception
 * 요청 수량이 유효 가용 용량을 넘을 때 발생하는 예외
 * 클라이언트가 수량을 다시 고를 수 있도록 남은 수량을 함께 전달
 */
public class CapacityExceededException extends BusinessException {

    private final int requested;
    private final int available;

    public CapacityExceededException(Long slotId, int requested, int available) {
        super(ErrorCode.CAPACITY_EXCEEDED,
                String.format("Only %d available: slotId=%d, requested=%d", available, slotId, requested));
        this.requested = requested;
        this.available = available;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("available", available, "requested", requested);
    }
}
