package personal.ai.capacity.schedule.domain.model;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

/**
 * 요일 집합 <-> 7비트 마스크 변환 (월요일 bit0 ... 일요일 bit6)
 */
public final class WeekdayMask {

    private WeekdayMask() {
    }

    public static int encode(Set<DayOfWeek> days) {
        int mask = 0;
        for (DayOfWeek day : days) {
            mask |= 1 << (day.getValue() - 1);
        }
        return mask;
    }

    public static Set<DayOfWeek> decode(int mask) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            if ((mask & (1 << (day.getValue() - 1))) != 0) {
                days.add(day);
            }
        }
        return days;
    }
}
