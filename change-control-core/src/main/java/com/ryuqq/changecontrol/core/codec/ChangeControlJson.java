package com.ryuqq.changecontrol.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.changecontrol.core.generic.Attestation;
import com.ryuqq.changecontrol.core.generic.AuditDetails;
import com.ryuqq.changecontrol.core.generic.MultimediaRef;
import com.ryuqq.changecontrol.core.generic.PartyIdentified;
import com.ryuqq.changecontrol.core.generic.PartyProxy;
import com.ryuqq.changecontrol.core.generic.PartySelf;
import com.ryuqq.changecontrol.core.generic.RevisionHistory;
import com.ryuqq.changecontrol.core.generic.RevisionHistoryItem;
import com.ryuqq.changecontrol.core.identification.GenericId;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.terminology.CodePhrase;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import com.ryuqq.changecontrol.core.terminology.PlainText;
import com.ryuqq.changecontrol.core.terminology.TextValue;
import com.ryuqq.changecontrol.core.versioning.Contribution;
import com.ryuqq.changecontrol.core.versioning.ImportedVersion;
import com.ryuqq.changecontrol.core.versioning.OriginalVersion;
import com.ryuqq.changecontrol.core.versioning.Version;
import com.ryuqq.changecontrol.core.versioning.VersionedObject;

import java.time.Instant;

/**
 * Change Control 타입의 JSON 레코드 형태.
 *
 * <p>모든 객체는 첫 필드로 {@code _type} 구분자를 가지며, 이어서 고정된 순서로 필드가
 * 나옵니다. 선택 필드는 없으면 생략하며 null로 쓰지 않습니다. payload는 Jackson으로
 * 직렬화하고, 출력이 바이트 단위로 안정되도록 property와 map key를 정렬합니다.</p>
 *
 * <p><strong>형태:</strong></p>
 * <ul>
 *   <li>{@code ORIGINAL_VERSION}, {@code IMPORTED_VERSION}</li>
 *   <li>{@code CONTRIBUTION}</li>
 *   <li>{@code REVISION_HISTORY}, {@code REVISION_HISTORY_ITEM}</li>
 *   <li>{@code AUDIT_DETAILS}, {@code ATTESTATION}</li>
 *   <li>{@code VERSIONED_OBJECT}</li>
 * </ul>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class ChangeControlJson {

    static final String TYPE = "_type";

    private static final ObjectMapper MAPPER = createObjectMapper();

    private ChangeControlJson() {
    }

    /**
     * 레코드 형태와 payload에 쓰는 mapper 생성.
     */
    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        return mapper;
    }

    /**
     * 바이트 단위로 안정된 출력을 내도록 설정한 공유 mapper.
     *
     * @return object mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * 버전의 정규 형태. 최상위 {@code signature}를 뺀 전체 형태.
     *
     * @param version 버전
     * @return 공백 없는 JSON
     */
    public static String canonicalForm(Version<?> version) {
        ObjectNode node = versionNode(version);
        node.remove("signature");
        return write(node);
    }

    public static String toJson(Version<?> version) {
        return write(versionNode(version));
    }

    public static String toJson(Contribution contribution) {
        return write(contributionNode(contribution));
    }

    public static String toJson(RevisionHistory revisionHistory) {
        return write(revisionHistoryNode(revisionHistory));
    }

    /**
     * VersionedObject 형태.
     *
     * @param versionedObject 컨테이너
     * @param includeRevisionHistory {@code revision_history} 필드 포함 여부
     * @param includeVersions 커밋 순서의 {@code versions} 필드 포함 여부
     * @return 공백 없는 JSON
     */
    public static String toJson(VersionedObject<?> versionedObject, boolean includeRevisionHistory, boolean includeVersions) {
        ObjectNode node = typed("VERSIONED_OBJECT");
        node.set("uid", objectIdNode(versionedObject.uid()));
        node.set("owner_id", objectRefNode(versionedObject.ownerId()));
        node.set("time_created", dateTimeNode(versionedObject.timeCreated()));
        if (includeRevisionHistory) {
            node.set("revision_history", revisionHistoryNode(versionedObject.revisionHistory()));
        }
        if (includeVersions) {
            ArrayNode versions = node.putArray("versions");
            for (Version<?> version : versionedObject.allVersions()) {
                versions.add(versionNode(version));
            }
        }
        return write(node);
    }

    /**
     * 버전의 tree 형태.
     *
     * @param version 버전
     * @return 호출자가 소유하는 가변 node
     */
    public static ObjectNode versionNode(Version<?> version) {
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        if (version instanceof ImportedVersion) {
            ImportedVersion<?> imported = (ImportedVersion<?>) version;
            ObjectNode node = typed("IMPORTED_VERSION");
            putVersionCommon(node, imported);
            node.set("item", versionNode(imported.item()));
            return node;
        }
        OriginalVersion<?> original = (OriginalVersion<?>) version;
        ObjectNode node = typed("ORIGINAL_VERSION");
        putVersionCommon(node, original);
        node.set("uid", objectIdNode(original.uid()));
        original.precedingVersionUid().ifPresent(id -> node.set("preceding_version_uid", objectIdNode(id)));
        if (original.isMerged()) {
            ArrayNode inputs = node.putArray("other_input_version_uids");
            for (ObjectVersionId id : original.otherInputVersionUids()) {
                inputs.add(objectIdNode(id));
            }
        }
        if (original.hasAttestations()) {
            ArrayNode attestations = node.putArray("attestations");
            for (Attestation attestation : original.attestations()) {
                attestations.add(auditNode(attestation));
            }
        }
        node.set("lifecycle_state", textNode(original.lifecycleState()));
        if (original.data() != null) {
            node.set("data", MAPPER.valueToTree(original.data()));
        }
        return node;
    }

    private static void putVersionCommon(ObjectNode node, Version<?> version) {
        node.set("contribution", objectRefNode(version.contribution()));
        version.signature().ifPresent(signature -> node.put("signature", signature));
        node.set("commit_audit", auditNode(version.commitAudit()));
    }

    static ObjectNode contributionNode(Contribution contribution) {
        ObjectNode node = typed("CONTRIBUTION");
        node.set("uid", objectIdNode(contribution.uid()));
        ArrayNode versions = node.putArray("versions");
        for (ObjectRef ref : contribution.versions()) {
            versions.add(objectRefNode(ref));
        }
        node.set("audit", auditNode(contribution.audit()));
        return node;
    }

    static ObjectNode revisionHistoryNode(RevisionHistory revisionHistory) {
        ObjectNode node = typed("REVISION_HISTORY");
        ArrayNode items = node.putArray("items");
        for (RevisionHistoryItem item : revisionHistory.items()) {
            ObjectNode itemNode = typed("REVISION_HISTORY_ITEM");
            itemNode.set("version_id", objectIdNode(item.versionId()));
            ArrayNode audits = itemNode.putArray("audits");
            for (AuditDetails audit : item.audits()) {
                audits.add(auditNode(audit));
            }
            items.add(itemNode);
        }
        return node;
    }

    static ObjectNode auditNode(AuditDetails audit) {
        boolean attestation = audit instanceof Attestation;
        ObjectNode node = typed(attestation ? "ATTESTATION" : "AUDIT_DETAILS");
        node.put("system_id", audit.systemId());
        node.set("time_committed", dateTimeNode(audit.timeCommitted()));
        node.set("change_type", textNode(audit.changeType()));
        audit.description().ifPresent(description -> node.set("description", textNode(description)));
        node.set("committer", partyNode(audit.committer()));
        if (attestation) {
            Attestation att = (Attestation) audit;
            att.attestedView().ifPresent(view -> node.set("attested_view", multimediaNode(view)));
            att.proof().ifPresent(proof -> node.put("proof", proof));
            if (att.hasItems()) {
                ArrayNode items = node.putArray("items");
                att.items().forEach(items::add);
            }
            node.set("reason", textNode(att.reason()));
            node.put("is_pending", att.isPending());
        }
        return node;
    }

    static ObjectNode partyNode(PartyProxy party) {
        if (party instanceof PartySelf) {
            ObjectNode node = typed("PARTY_SELF");
            party.externalRef().ifPresent(ref -> node.set("external_ref", objectRefNode(ref)));
            return node;
        }
        PartyIdentified identified = (PartyIdentified) party;
        ObjectNode node = typed("PARTY_IDENTIFIED");
        identified.externalRef().ifPresent(ref -> node.set("external_ref", objectRefNode(ref)));
        identified.name().ifPresent(name -> node.put("name", name));
        return node;
    }

    static ObjectNode textNode(TextValue text) {
        if (text instanceof PlainText) {
            ObjectNode node = typed("DV_TEXT");
            node.put("value", text.value());
            return node;
        }
        CodedText coded = (CodedText) text;
        ObjectNode node = typed("DV_CODED_TEXT");
        node.put("value", coded.value());
        node.set("defining_code", codePhraseNode(coded.definingCode()));
        return node;
    }

    static ObjectNode codePhraseNode(CodePhrase code) {
        ObjectNode node = typed("CODE_PHRASE");
        ObjectNode terminology = typed("TERMINOLOGY_ID");
        terminology.put("value", code.terminologyId());
        node.set("terminology_id", terminology);
        node.put("code_string", code.codeString());
        return node;
    }

    static ObjectNode objectRefNode(ObjectRef ref) {
        ObjectNode node = typed("OBJECT_REF");
        node.put("namespace", ref.namespace());
        node.put("type", ref.type());
        node.set("id", objectIdNode(ref.id()));
        return node;
    }

    static ObjectNode objectIdNode(ObjectId id) {
        ObjectNode node;
        if (id instanceof HierObjectId) {
            node = typed("HIER_OBJECT_ID");
        } else if (id instanceof ObjectVersionId) {
            node = typed("OBJECT_VERSION_ID");
        } else if (id instanceof GenericId) {
            node = typed("GENERIC_ID");
        } else {
            node = typed("OBJECT_ID");
        }
        node.put("value", id.value());
        if (id instanceof GenericId) {
            node.put("scheme", ((GenericId) id).scheme());
        }
        return node;
    }

    private static ObjectNode multimediaNode(MultimediaRef view) {
        ObjectNode node = typed("DV_MULTIMEDIA");
        node.put("media_type", view.mediaType());
        node.put("uri", view.uri().toString());
        return node;
    }

    private static ObjectNode dateTimeNode(Instant time) {
        ObjectNode node = typed("DV_DATE_TIME");
        JsonNode value = MAPPER.valueToTree(time);
        node.set("value", value);
        return node;
    }

    private static ObjectNode typed(String type) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(TYPE, type);
        return node;
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write change control JSON", e);
        }
    }
}
