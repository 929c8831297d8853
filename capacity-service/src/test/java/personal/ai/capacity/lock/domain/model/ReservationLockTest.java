package personal.ai.capacity.lock.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.capacity.lock.domain.exception.ExpiredOrMismatchedLockException;
import personal.ai.common.exception.BusinessException;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("ReservationLock 도메인 모델 단위 테스트")
class ReservationLockTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Test
    @DisplayName("홀드는 생성 시각 + TTL에 만료되며 만료 시각부터 무효다")
    void expiryBoundary() {
        // given
        ReservationLock lock = ReservationLock.create(1L, "session-a", 2, Duration.ofSeconds(120), NOW);

        // then
        assertThat(lock.expiresAt()).isEqualTo(NOW.plusSeconds(120));
        assertThat(lock.isValidFor("session-a", NOW.plusSeconds(119))).isTrue();
        assertThat(lock.isValidFor("session-a", NOW.plusSeconds(120))).isFalse();
        assertThat(lock.isValidFor("session-b", NOW)).isFalse();
    }

    @Test
    @DisplayName("예약 생성 시 보유자, 슬롯, 수량이 모두 맞아야 홀드로 덮을 수 있다")
    void ensureCovers() {
        ReservationLock lock = ReservationLock.create(1L, "session-a", 2, Duration.ofSeconds(120), NOW);

        assertThatCode(() -> lock.ensureCovers("session-a", 1L, 2, NOW)).doesNotThrowAnyException();
        assertThatThrownBy(() -> lock.ensureCovers("session-b", 1L, 2, NOW))
                .isInstanceOf(ExpiredOrMismatchedLockException.class);
        assertThatThrownBy(() -> lock.ensureCovers("session-a", 2L, 2, NOW))
                .isInstanceOf(ExpiredOrMismatchedLockException.class);
        assertThatThrownBy(() -> lock.ensureCovers("session-a", 1L, 3, NOW))
                .isInstanceOf(ExpiredOrMismatchedLockException.class);
        assertThatThrownBy(() -> lock.ensureCovers("session-a", 1L, 2, NOW.plusSeconds(300)))
                .isInstanceOf(ExpiredOrMismatchedLockException.class);
    }

    @Test
    @DisplayName("수량이 0 이하인 홀드는 만들 수 없다")
    void invalidQuantity() {
        assertThatThrownBy(() -> ReservationLock.create(1L, "session-a", 0, Duration.ofSeconds(120), NOW))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("quantity");
    }
}
