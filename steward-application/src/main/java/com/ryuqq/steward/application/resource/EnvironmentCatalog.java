package com.ryuqq.steward.application.resource;

import com.ryuqq.steward.core.error.ResourceNotFoundException;
import com.ryuqq.steward.core.model.ResourceId;
import com.ryuqq.steward.core.model.UnitId;
import com.ryuqq.steward.core.resource.Resource;
import com.ryuqq.steward.core.spi.ResourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * 환경 조회/생성 서비스 (락 없이 동기 실행).
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class EnvironmentCatalog {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentCatalog.class);

    private final ResourceRepository repository;

    public EnvironmentCatalog(ResourceRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        this.repository = repository;
    }

    /**
     * 환경 조회.
     *
     * @param id 환경 ID
     * @return 환경
     * @throws ResourceNotFoundException 존재하지 않는 경우
     */
    public Resource find(ResourceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return repository.find(id);
    }

    /**
     * 빈 환경 생성.
     *
     * @param id 환경 ID
     * @return 생성된 환경
     * @throws IllegalStateException 이미 존재하는 경우
     */
    public Resource create(ResourceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Resource created = repository.create(id);
        log.info("Environment created: {}", id.getValue());
        return created;
    }

    /**
     * 전체 환경 목록 (ID 순).
     *
     * @return 환경 목록
     */
    public List<Resource> list() {
        return repository.list().stream()
            .sorted(Comparator.comparing(resource -> resource.id().getValue()))
            .toList();
    }

    /**
     * 환경의 멤버 유닛 목록.
     *
     * @param id 환경 ID
     * @return 유닛 목록
     * @throws ResourceNotFoundException 존재하지 않는 경우
     */
    public List<UnitId> members(ResourceId id) {
        return repository.listMembers(find(id));
    }
}
