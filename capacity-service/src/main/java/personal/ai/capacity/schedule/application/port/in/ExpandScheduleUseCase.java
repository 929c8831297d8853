package personal.ai.capacity.schedule.application.port.in;

/**
 * Expand Schedule UseCase (Input Port)
 * 근무 일정을 기간 내 예약 슬롯으로 전개 (같은 기간 재실행 시 기존 슬롯을 지우고 다시 생성)
 */
public interface ExpandScheduleUseCase {

    /**
     * @return 생성된 슬롯 수
     * @throws personal.ai.capacity.schedule.domain.exception.ShiftNotFoundException 근무 일정 없음 (쓰기 없음)
     */
    int expandSchedule(ExpandScheduleCommand command);
}
