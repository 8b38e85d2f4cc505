package com.ryuqq.changecontrol.core.terminology;

/**
 * 감사 및 버전 메타데이터 생성 시 멤버십을 검사하는 terminology 그룹.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public enum TerminologyGroup {

    AUDIT_CHANGE_TYPE("audit change type"),
    VERSION_LIFECYCLE_STATE("version lifecycle state"),
    ATTESTATION_REASON("attestation reason");

    private final String groupId;

    TerminologyGroup(String groupId) {
        this.groupId = groupId;
    }

    /**
     * terminology가 공개한 그룹 식별자.
     *
     * @return 그룹 ID
     */
    public String groupId() {
        return groupId;
    }
}
