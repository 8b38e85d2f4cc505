package com.ryuqq.changecontrol.core.spi;

import com.ryuqq.changecontrol.core.exception.InvalidContributionException;
import com.ryuqq.changecontrol.core.identification.ObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.versioning.Contribution;
import com.ryuqq.changecontrol.core.versioning.Version;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 원자적 Contribution 커밋의 사전 조건. Store 구현체들이 공유한다.
 *
 * <p>batch가 일관된 조건:</p>
 * <ul>
 *   <li>버전이 하나 이상이고 같은 version id가 두 번 나오지 않음</li>
 *   <li>모든 버전의 contribution 참조가 해당 Contribution을 가리킴</li>
 *   <li>Contribution의 모든 버전 참조가 batch 안의 버전으로 해석됨</li>
 * </ul>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class ContributionBatch {

    private ContributionBatch() {
    }

    /**
     * 커밋 batch 검사. 아무것도 저장하지 않는다.
     *
     * @param contribution Contribution
     * @param versions 함께 커밋되는 버전
     * @throws InvalidContributionException batch가 일관되지 않은 경우
     */
    public static void verify(Contribution contribution, List<? extends Version<?>> versions) {
        if (contribution == null) {
            throw new InvalidContributionException("contribution cannot be null");
        }
        if (versions == null || versions.isEmpty()) {
            throw new InvalidContributionException("Contribution " + contribution.uid() + " has no versions to commit");
        }
        Set<ObjectId> versionIds = new HashSet<>();
        for (Version<?> version : versions) {
            if (version == null) {
                throw new InvalidContributionException("Contribution " + contribution.uid() + " contains a null version");
            }
            if (!contribution.uid().equals(version.contribution().id())) {
                throw new InvalidContributionException(
                    "Version " + version.uid() + " references contribution " + version.contribution().id()
                        + " instead of " + contribution.uid()
                );
            }
            if (!versionIds.add(version.uid())) {
                throw new InvalidContributionException(
                    "Version " + version.uid() + " appears twice in contribution " + contribution.uid()
                );
            }
        }
        for (ObjectRef ref : contribution.versions()) {
            if (!versionIds.contains(ref.id())) {
                throw new InvalidContributionException(
                    "Contribution " + contribution.uid() + " references version " + ref.id() + " which is not in the batch"
                );
            }
        }
    }
}
