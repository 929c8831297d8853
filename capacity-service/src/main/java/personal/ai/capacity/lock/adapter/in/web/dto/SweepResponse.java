package personal.ai.capacity.lock.adapter.in.web.dto;

/**
 * 만료 홀드 정리 결과 DTO
 */
public record SweepResponse(
        int removed
) {}
