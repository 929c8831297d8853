package personal.ai.capacity.lock.application.port.in;

import java.util.Collection;
import java.util.Map;

/**
 * Query Held Capacity UseCase (Input Port)
 * 슬롯별 미만료 홀드 수량 조회 (요청한 모든 슬롯 id가 결과에 포함, 홀드가 없으면 0)
 */
public interface QueryHeldCapacityUseCase {

    Map<Long, Integer> queryHeldCapacity(Collection<Long> slotIds);
}
