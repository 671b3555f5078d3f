package com.ryuqq.steward.core.error;

import com.ryuqq.steward.core.model.ResourceId;

/**
 * 대상 리소스가 존재하지 않음.
 *
 * <p>어떤 변경도 일어나기 전에 요청을 중단시키며, Job FAILURE로 표면화됩니다.</p>
 *
 * @author Steward Team
 * @since 1.0.0
 */
public class ResourceNotFoundException extends StewardException {

    public static final String ERROR_CODE = "RESOURCE-404";

    private final ResourceId resourceId;

    public ResourceNotFoundException(ResourceId resourceId) {
        super(ERROR_CODE, "Environment '" + (resourceId == null ? null : resourceId.getValue()) + "' not found");
        this.resourceId = resourceId;
    }

    public ResourceId getResourceId() {
        return resourceId;
    }
}
