package com.ryuqq.steward.core.lock;

import com.ryuqq.steward.core.model.OwnerId;
import com.ryuqq.steward.core.model.ResourceId;

import java.time.Instant;

/**
 * 공유 레코드 저장소에 영속되는 락 소유 표식.
 *
 * <p>리소스당 최대 하나만 존재합니다. 최초 획득 시 생성되고 해제 시 삭제됩니다.</p>
 *
 * @param resource 락 대상 리소스 (유일 키)
 * @param owner 소유자
 * @param acquiredAt 획득 시각
 *
 * @author Steward Team
 * @since 1.0.0
 */
public record LockRecord(
    ResourceId resource,
    OwnerId owner,
    Instant acquiredAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드 중 하나라도 null인 경우
     */
    public LockRecord {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (acquiredAt == null) {
            throw new IllegalArgumentException("acquiredAt cannot be null");
        }
    }

    /**
     * 주어진 소유자가 이 락을 보유하고 있는지 확인.
     *
     * @param candidate 확인할 소유자
     * @return 소유자가 같으면 true
     */
    public boolean isOwnedBy(OwnerId candidate) {
        return owner.equals(candidate);
    }
}
