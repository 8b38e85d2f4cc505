package com.ryuqq.changecontrol.core.terminology;

import com.ryuqq.changecontrol.core.spi.TerminologyValidator;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * openEHR support terminology 코드 집합 기반 validator.
 *
 * <p>Change Control이 사용하는 세 그룹을 다룹니다. terminology id가 {@value #TERMINOLOGY_ID}이고
 * code string이 해당 그룹 목록에 있을 때만 멤버로 인정합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TerminologyValidator validator = OpenEhrSupportTerminology.instance();
 * validator.verifyCodeInGroup(AuditChangeType.CREATION.codePhrase(), TerminologyGroup.AUDIT_CHANGE_TYPE); // true
 * </pre>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class OpenEhrSupportTerminology implements TerminologyValidator {

    public static final String TERMINOLOGY_ID = "openehr";

    private static final OpenEhrSupportTerminology INSTANCE = new OpenEhrSupportTerminology();

    private final Map<TerminologyGroup, Set<String>> codesByGroup;

    private OpenEhrSupportTerminology() {
        Map<TerminologyGroup, Set<String>> codes = new EnumMap<>(TerminologyGroup.class);
        codes.put(TerminologyGroup.AUDIT_CHANGE_TYPE, codesOf(AuditChangeType.values(), AuditChangeType::code));
        codes.put(TerminologyGroup.VERSION_LIFECYCLE_STATE, codesOf(VersionLifecycleState.values(), VersionLifecycleState::code));
        codes.put(TerminologyGroup.ATTESTATION_REASON, codesOf(AttestationReason.values(), AttestationReason::code));
        this.codesByGroup = Collections.unmodifiableMap(codes);
    }

    private static <E extends Enum<E>> Set<String> codesOf(E[] values, Function<E, String> code) {
        return Arrays.stream(values).map(code).collect(Collectors.toUnmodifiableSet());
    }

    public static OpenEhrSupportTerminology instance() {
        return INSTANCE;
    }

    @Override
    public boolean verifyCodeInGroup(CodePhrase code, TerminologyGroup group) {
        if (code == null || group == null) {
            return false;
        }
        if (!TERMINOLOGY_ID.equals(code.terminologyId())) {
            return false;
        }
        return codesByGroup.getOrDefault(group, Set.of()).contains(code.codeString());
    }

    /**
     * 그룹의 모든 code string 조회.
     *
     * @param group terminology 그룹
     * @return 수정 불가능한 code string 집합
     */
    public Set<String> codesFor(TerminologyGroup group) {
        return codesByGroup.getOrDefault(group, Set.of());
    }
}
