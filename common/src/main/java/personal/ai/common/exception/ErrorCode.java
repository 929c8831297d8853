package personal.ai.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Schedule Domain (Sxxx)
    SHIFT_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "근무 일정을 찾을 수 없습니다."),
    SLOT_NOT_FOUND(HttpStatus.NOT_FOUND, "S002", "예약 시간대를 찾을 수 없습니다."),
    SLOT_NOT_OPEN(HttpStatus.CONFLICT, "S003", "현재 예약을 받지 않는 시간대입니다. 다른 시간대를 선택해주세요."),
    SLOTS_HAVE_BOOKINGS(HttpStatus.CONFLICT, "S004", "예약이 있는 시간대가 포함되어 일정을 다시 만들 수 없습니다. 예약을 옮기거나 기간을 조정해주세요."),

    // Capacity Domain (Kxxx)
    CAPACITY_EXCEEDED(HttpStatus.CONFLICT, "K001", "요청 수량이 남은 수량을 초과했습니다. 남은 수량 이내로 다시 선택해주세요."),
    CONCURRENT_CAPACITY_UPDATE(HttpStatus.CONFLICT, "K002", "동시에 많은 요청이 처리되고 있습니다. 잠시 후 다시 시도해주세요."),

    // Lock Domain (Lxxx)
    LOCK_NOT_FOUND(HttpStatus.NOT_FOUND, "L001", "예약 홀드를 찾을 수 없습니다."),
    LOCK_EXPIRED_OR_MISMATCHED(HttpStatus.CONFLICT, "L002", "예약 홀드가 만료되었습니다. 처음부터 다시 시도해주세요."),

    // Booking Domain (Bxxx)
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    INVALID_BOOKING_STATE(HttpStatus.BAD_REQUEST, "B002", "현재 예약 상태에서는 처리할 수 없는 요청입니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
