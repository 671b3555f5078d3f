package com.ryuqq.steward.core.lock;

import com.ryuqq.steward.core.error.StewardException;
import com.ryuqq.steward.core.model.ResourceId;

import java.util.Optional;

/**
 * 다른 소유자가 락을 보유하고 있어 획득에 실패함.
 *
 * <p>현재 보유자의 identity와 획득 시각을 함께 전달하며,
 * 호출자는 {@code force} 플래그로 재시도할 수 있습니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class LockConflictException extends StewardException {

    public static final String ERROR_CODE = "LOCK-409";

    private final ResourceId resource;
    private final LockRecord holder;

    /**
     * 생성자.
     *
     * @param resource 락 대상 리소스
     * @param holder 현재 보유자 (경합으로 레코드가 사라진 경우 null)
     */
    public LockConflictException(ResourceId resource, LockRecord holder) {
        super(ERROR_CODE, describe(resource, holder));
        this.resource = resource;
        this.holder = holder;
    }

    public ResourceId getResource() {
        return resource;
    }

    public Optional<LockRecord> getHolder() {
        return Optional.ofNullable(holder);
    }

    private static String describe(ResourceId resource, LockRecord holder) {
        String name = resource == null ? null : resource.getValue();
        if (holder == null) {
            return "Resource '" + name + "' is locked by another owner";
        }
        return "Resource '" + name + "' is locked by " + holder.owner().getValue()
            + " since " + holder.acquiredAt();
    }
}
