package personal.ai.common.exception;

import java.util.Map;

/**
 * 비즈니스 예외 최상위 클래스
 * ErrorCode로 HTTP 상태와 사용자 메시지를 결정하고,
 * 예외 메시지(detail)는 서버 로그 용도로만 사용한다.
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 클라이언트에 함께 전달할 부가 정보
     * (예: 남은 수량) 기본값은 비어 있음
     */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
