package personal.ai.capacity.lock.application.port.in;

import java.util.UUID;

/**
 * Validate Lock UseCase (Input Port)
 * 홀드가 존재하고, 보유자가 일치하며, 만료되지 않았는지 확인
 */
public interface ValidateLockUseCase {

    boolean validateLock(UUID lockId, String holderId);
}
