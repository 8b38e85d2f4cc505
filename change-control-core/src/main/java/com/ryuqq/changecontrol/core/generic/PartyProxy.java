package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.identification.ObjectRef;

import java.util.Optional;

/**
 * party의 proxy 표현. demographic 또는 identity 관리 시스템과 연결될 수 있다.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public sealed interface PartyProxy permits PartySelf, PartyIdentified {

    /**
     * 외부 시스템에 있는 party 상세 정보 참조.
     *
     * @return 외부 참조 (있는 경우)
     */
    Optional<ObjectRef> externalRef();
}
