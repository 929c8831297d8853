package personal.ai.capacity.booking.adapter.out.capacity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.capacity.slot.domain.model.CapacityCharge;
import personal.ai.capacity.slot.domain.service.CapacityMutationTrigger;

import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingCapacityAdapter 단위 테스트")
class BookingCapacityAdapterTest {

    @Mock
    private CapacityMutationTrigger capacityMutationTrigger;

    @InjectMocks
    private BookingCapacityAdapter adapter;

    @Test
    @DisplayName("변경 전후 부과량을 그대로 트리거에 넘긴다")
    void applyCapacityChange_DelegatesToTrigger() {
        CapacityCharge previous = new CapacityCharge(7L, 2);

        adapter.applyCapacityChange(55L, previous, CapacityCharge.none());

        then(capacityMutationTrigger).should().onBookingWritten(55L, previous, CapacityCharge.none());
    }
}
