package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.exception.EmptyCollectionException;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 버전의 감사 이력. commit audit 다음에 attestation이 기록 순서대로 이어진다.
 *
 * @param versionId 감사 기록이 속한 버전
 * @param audits commit audit이 먼저, 이어서 attestation (빈 값 불가)
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record RevisionHistoryItem(
    ObjectVersionId versionId,
    List<AuditDetails> audits
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException versionId 또는 audits가 null인 경우
     * @throws EmptyCollectionException audits가 비어 있는 경우
     */
    public RevisionHistoryItem {
        if (versionId == null) {
            throw new IllegalArgumentException("versionId cannot be null");
        }
        if (audits == null) {
            throw new IllegalArgumentException("audits cannot be null");
        }
        if (audits.isEmpty()) {
            throw new EmptyCollectionException("audits of revision history item " + versionId + " must not be empty");
        }
        audits = List.copyOf(audits);
    }

    public static RevisionHistoryItem of(ObjectVersionId versionId, AuditDetails commitAudit) {
        return new RevisionHistoryItem(versionId, List.of(commitAudit));
    }

    /**
     * 버전을 만든 커밋의 감사 기록.
     *
     * @return 첫 번째 감사
     */
    public AuditDetails commitAudit() {
        return audits.get(0);
    }

    public AuditDetails lastAudit() {
        return audits.get(audits.size() - 1);
    }

    /**
     * 끝에 감사 하나를 더한 사본.
     *
     * @param audit 추가할 감사
     * @return 새 item
     */
    public RevisionHistoryItem appendAudit(AuditDetails audit) {
        if (audit == null) {
            throw new IllegalArgumentException("audit cannot be null");
        }
        List<AuditDetails> appended = new ArrayList<>(audits.size() + 1);
        appended.addAll(audits);
        appended.add(audit);
        return new RevisionHistoryItem(versionId, appended);
    }
}
