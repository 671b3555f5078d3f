package com.ryuqq.steward.application.lock;

import com.ryuqq.steward.core.lock.LockConflictException;
import com.ryuqq.steward.core.lock.LockRecord;
import com.ryuqq.steward.core.model.OwnerId;
import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.spi.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 공유 레코드 저장소 위에서 동작하는 리소스 단위 분산 락.
 *
 * <p>락은 리소스 이름을 키로 하는 {@link LockRecord} 하나로 표현됩니다.
 * 서로 다른 프로세스도 같은 {@link RecordStore}를 바라보는 한 상호 배제가 보장됩니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>acquire: 레코드가 없으면 생성, 자신 소유면 true (재진입), 타인 소유면 false</li>
 *   <li>release: 자신 소유일 때만 삭제, 그 외에는 false</li>
 *   <li>forceRelease: 소유자와 무관하게 삭제 (명시적 force 요청 전용)</li>
 *   <li>블로킹 대기나 재시도는 하지 않음</li>
 * </ul>
 *
 * <p><strong>권장 사용법:</strong> 직접 acquire/release를 호출하지 말고
 * {@link #runExclusive(ResourceId, OwnerId, boolean, Supplier)}를 사용합니다.
 * 본문이 예외로 끝나더라도 해제가 시도됩니다.</p>
 *
 * <pre>
 * lock.runExclusive(resourceId, owner, request.force(), () -&gt; {
 *     repository.persist(merged);
 *     return fanOut.run(units, operation);
 * });
 * </pre>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(DistributedLock.class);

    private final RecordStore store;
    private final Clock clock;
    private final Map<ResourceId, OwnerId> held = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param store 공유 레코드 저장소
     * @param clock 획득 시각 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DistributedLock(RecordStore store, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.clock = clock;
    }

    /**
     * 락 획득 시도 (비블로킹).
     *
     * <p>읽기 후 생성합니다. 생성이 경합에서 지면 다시 읽어 승자의 소유 여부를 보고합니다.</p>
     *
     * @param resource 대상 리소스
     * @param owner 소유자
     * @return 획득(또는 이미 보유)했으면 true, 타인이 보유 중이면 false
     */
    public boolean acquire(ResourceId resource, OwnerId owner) {
        validate(resource, owner);

        Optional<LockRecord> existing = store.find(resource);
        if (existing.isPresent()) {
            return track(existing.get(), owner);
        }

        LockRecord record = new LockRecord(resource, owner, clock.instant());
        if (store.create(record)) {
            held.put(resource, owner);
            log.debug("Lock acquired: resource={}, owner={}", resource.getValue(), owner.getValue());
            return true;
        }

        // lost the create race
        return store.find(resource)
            .map(winner -> track(winner, owner))
            .orElse(false);
    }

    /**
     * 락 해제.
     *
     * @param resource 대상 리소스
     * @param owner 소유자
     * @return 자신 소유 레코드를 삭제했으면 true, 레코드가 없거나 타인 소유면 false
     */
    public boolean release(ResourceId resource, OwnerId owner) {
        validate(resource, owner);

        Optional<LockRecord> existing = store.find(resource);
        if (existing.isEmpty() || !existing.get().isOwnedBy(owner)) {
            return false;
        }
        held.remove(resource, owner);
        boolean deleted = store.delete(resource);
        if (deleted) {
            log.debug("Lock released: resource={}, owner={}", resource.getValue(), owner.getValue());
        }
        return deleted;
    }

    /**
     * 소유자와 무관하게 락 레코드 삭제.
     *
     * @param resource 대상 리소스
     * @return 레코드가 삭제되었으면 true
     */
    public boolean forceRelease(ResourceId resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        Optional<LockRecord> previous = store.find(resource);
        held.remove(resource);
        boolean deleted = store.delete(resource);
        if (deleted) {
            log.warn("Lock force-released: resource={}, previousOwner={}, acquiredAt={}",
                resource.getValue(),
                previous.map(r -> r.owner().getValue()).orElse("unknown"),
                previous.map(r -> r.acquiredAt().toString()).orElse("unknown"));
        }
        return deleted;
    }

    /**
     * 락을 보유한 상태로 본문 실행.
     *
     * <p><strong>실행 순서:</strong></p>
     * <ol>
     *   <li>force이면 기존 레코드를 강제 해제</li>
     *   <li>acquire 실패 시 {@link LockConflictException} (본문은 실행되지 않음)</li>
     *   <li>본문 실행</li>
     *   <li>모든 종료 경로에서 release 시도 (실패는 로깅만 함)</li>
     * </ol>
     *
     * @param resource 대상 리소스
     * @param owner 소유자
     * @param force 기존 보유자를 무시할지 여부
     * @param body 락 보유 중 실행할 본문
     * @param <T> 본문 결과 타입
     * @return 본문 결과
     * @throws LockConflictException 다른 소유자가 보유 중인 경우
     */
    public <T> T runExclusive(ResourceId resource, OwnerId owner, boolean force, Supplier<T> body) {
        validate(resource, owner);
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }

        if (force) {
            forceRelease(resource);
        }

        if (!acquire(resource, owner)) {
            LockRecord holder = store.find(resource).orElse(null);
            log.warn("Lock conflict: resource={}, requestedBy={}, heldBy={}",
                resource.getValue(), owner.getValue(),
                holder == null ? "unknown" : holder.owner().getValue());
            throw new LockConflictException(resource, holder);
        }

        try {
            return body.get();
        } finally {
            releaseQuietly(resource, owner);
        }
    }

    /**
     * 결과가 없는 본문용 {@link #runExclusive(ResourceId, OwnerId, boolean, Supplier)}.
     */
    public void runExclusive(ResourceId resource, OwnerId owner, boolean force, Runnable body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        runExclusive(resource, owner, force, () -> {
            body.run();
            return null;
        });
    }

    /**
     * 현재 보유자 조회 (진단용).
     *
     * @param resource 대상 리소스
     * @return 락 레코드, 없으면 empty
     */
    public Optional<LockRecord> holder(ResourceId resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        return store.find(resource);
    }

    /**
     * 이 인스턴스가 owner를 위해 획득한 모든 락 해제 (프로세스 종료 정리).
     *
     * @param owner 소유자
     * @return 해제된 락 개수
     */
    public int releaseHeld(OwnerId owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        List<ResourceId> resources = new ArrayList<>();
        held.forEach((resource, holder) -> {
            if (holder.equals(owner)) {
                resources.add(resource);
            }
        });

        int released = 0;
        for (ResourceId resource : resources) {
            try {
                if (release(resource, owner)) {
                    released++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to release lock on shutdown: resource={}, owner={}",
                    resource.getValue(), owner.getValue(), e);
            }
        }
        if (released > 0) {
            log.info("Released {} held lock(s) for owner {}", released, owner.getValue());
        }
        return released;
    }

    private boolean track(LockRecord record, OwnerId owner) {
        if (!record.isOwnedBy(owner)) {
            return false;
        }
        held.put(record.resource(), owner);
        return true;
    }

    private void releaseQuietly(ResourceId resource, OwnerId owner) {
        try {
            if (!release(resource, owner)) {
                log.warn("Lock was not held at release: resource={}, owner={}",
                    resource.getValue(), owner.getValue());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release lock: resource={}, owner={}",
                resource.getValue(), owner.getValue(), e);
        }
    }

    private static void validate(ResourceId resource, OwnerId owner) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
    }
}
