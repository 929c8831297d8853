package personal.ai.capacity.lock.adapter.in.web.dto;

import java.util.UUID;

/**
 * 홀드 해제 응답 DTO
 * released: 해제 시점에 유효했던 홀드인지 (만료 후 해제면 false)
 */
public record LockReleaseResponse(
        UUID lockId,
        boolean released
) {}
