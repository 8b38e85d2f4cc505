package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.exception.VersionNotFoundException;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * VersionedObject 하나의 모든 감사 기록과 attestation 이력.
 *
 * <p>item은 커밋 순서로, 가장 최근 것이 마지막에 옵니다. 버전마다 item은 정확히 하나입니다.
 * 이력은 불변이며 {@link #append}는 새 이력을 반환합니다 (전체 item 복사).</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class RevisionHistory {

    private static final RevisionHistory EMPTY = new RevisionHistory(List.of());

    private final List<RevisionHistoryItem> items;

    private RevisionHistory(List<RevisionHistoryItem> items) {
        this.items = items;
    }

    public static RevisionHistory empty() {
        return EMPTY;
    }

    /**
     * 커밋 순서의 item으로 이력 생성.
     *
     * @param items item 목록 (가장 최근 것이 마지막)
     * @return RevisionHistory 인스턴스
     * @throws IllegalArgumentException items가 null이거나 두 item의 version id가 같은 경우
     */
    public static RevisionHistory of(List<RevisionHistoryItem> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        long distinct = items.stream().map(RevisionHistoryItem::versionId).distinct().count();
        if (distinct != items.size()) {
            throw new IllegalArgumentException("RevisionHistory cannot hold two items for the same version");
        }
        return new RevisionHistory(List.copyOf(items));
    }

    /**
     * 커밋 순서의 item 조회 (가장 최근 것이 마지막).
     *
     * @return 수정 불가능한 리스트
     */
    public List<RevisionHistoryItem> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * 가장 최근에 커밋된 버전의 ID.
     *
     * @return 마지막 item의 version id
     * @throws VersionNotFoundException 이력이 비어 있는 경우
     */
    public ObjectVersionId mostRecentVersion() {
        return lastItem().versionId();
    }

    /**
     * 가장 최근 커밋 버전의 마지막 감사 시각.
     *
     * <p>해당 버전에 attestation이 있으면 마지막 attestation 시각입니다.</p>
     *
     * @return 마지막 item의 마지막 감사 커밋 시각
     * @throws VersionNotFoundException 이력이 비어 있는 경우
     */
    public Instant mostRecentVersionTimeCommitted() {
        return lastItem().lastAudit().timeCommitted();
    }

    public Optional<RevisionHistoryItem> itemFor(ObjectVersionId versionId) {
        for (RevisionHistoryItem item : items) {
            if (item.versionId().equals(versionId)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    /**
     * 버전에 감사 기록 추가.
     *
     * <p>버전의 item이 이미 있으면 그 item 끝에 추가하고, 없으면 새 item을 맨 끝에 추가합니다.</p>
     *
     * @param versionId 감사 기록이 속한 버전
     * @param audit 기록할 감사
     * @return 새 이력
     */
    public RevisionHistory append(ObjectVersionId versionId, AuditDetails audit) {
        List<RevisionHistoryItem> updated = new ArrayList<>(items.size() + 1);
        boolean found = false;
        for (RevisionHistoryItem item : items) {
            if (item.versionId().equals(versionId)) {
                updated.add(item.appendAudit(audit));
                found = true;
            } else {
                updated.add(item);
            }
        }
        if (!found) {
            updated.add(RevisionHistoryItem.of(versionId, audit));
        }
        return new RevisionHistory(List.copyOf(updated));
    }

    private RevisionHistoryItem lastItem() {
        if (items.isEmpty()) {
            throw new VersionNotFoundException("RevisionHistory is empty");
        }
        return items.get(items.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return items.equals(((RevisionHistory) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "RevisionHistory{items=" + items.size() + "}";
    }
}
