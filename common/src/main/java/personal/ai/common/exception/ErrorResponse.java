package personal.ai.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * 에러 응답 포맷
 *
 * @param result  항상 "error"
 * @param code    ErrorCode의 고유 코드 (예: K001)
 * @param message 사용자에게 노출할 메시지
 * @param details 부가 정보 (없으면 생략)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        String result,
        String code,
        String message,
        Map<String, Object> details
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse("error", errorCode.getCode(), message, Map.of());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details) {
        return new ErrorResponse("error", errorCode.getCode(), message, details);
    }
}
