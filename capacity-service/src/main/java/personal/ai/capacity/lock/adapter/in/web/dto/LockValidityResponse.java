package personal.ai.capacity.lock.adapter.in.web.dto;

import java.util.UUID;

/**
 * 홀드 유효성 응답 DTO
 */
public record LockValidityResponse(
        UUID lockId,
        boolean valid
) {}
