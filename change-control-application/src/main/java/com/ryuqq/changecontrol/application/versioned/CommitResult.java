package com.ryuqq.changecontrol.application.versioned;

import com.ryuqq.changecontrol.core.versioning.Contribution;
import com.ryuqq.changecontrol.core.versioning.Version;

import java.util.List;

/**
 * 성공한 커밋의 결과. 저장된 Contribution과 커밋 순서의 버전.
 *
 * @param contribution 저장된 Contribution
 * @param versions 함께 커밋된 버전
 * @param <T> payload 타입
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record CommitResult<T>(
    Contribution contribution,
    List<Version<T>> versions
) {

    public CommitResult {
        if (contribution == null) {
            throw new IllegalArgumentException("contribution cannot be null");
        }
        if (versions == null || versions.isEmpty()) {
            throw new IllegalArgumentException("versions cannot be null or empty");
        }
        versions = List.copyOf(versions);
    }

    /**
     * 버전 하나짜리 커밋의 그 버전.
     *
     * @return 첫 번째 버전
     */
    public Version<T> version() {
        return versions.get(0);
    }
}
