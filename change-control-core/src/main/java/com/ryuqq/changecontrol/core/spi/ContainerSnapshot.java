package com.ryuqq.changecontrol.core.spi;

import com.ryuqq.changecontrol.core.generic.RevisionHistory;

/**
 * {@link ChangeControlStore#retrieveContainer}가 반환하는 컨테이너 header와
 * revision history.
 *
 * @param header 컨테이너 메타데이터
 * @param revisionHistory 모든 버전의 감사 기록 (커밋 순서)
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record ContainerSnapshot(
    ContainerHeader header,
    RevisionHistory revisionHistory
) {

    public ContainerSnapshot {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (revisionHistory == null) {
            throw new IllegalArgumentException("revisionHistory cannot be null");
        }
    }
}
