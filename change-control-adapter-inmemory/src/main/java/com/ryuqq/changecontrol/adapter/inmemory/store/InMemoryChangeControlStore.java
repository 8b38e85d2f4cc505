package com.ryuqq.changecontrol.adapter.inmemory.store;

import com.ryuqq.changecontrol.core.exception.ContainerNotFoundException;
import com.ryuqq.changecontrol.core.exception.ContributionNotFoundException;
import com.ryuqq.changecontrol.core.exception.DuplicateObjectException;
import com.ryuqq.changecontrol.core.generic.Attestation;
import com.ryuqq.changecontrol.core.generic.PartyProxy;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.spi.ChangeControlStore;
import com.ryuqq.changecontrol.core.spi.ContainerHeader;
import com.ryuqq.changecontrol.core.spi.ContainerSnapshot;
import com.ryuqq.changecontrol.core.spi.ContributionBatch;
import com.ryuqq.changecontrol.core.spi.StoreAction;
import com.ryuqq.changecontrol.core.spi.StoreActionType;
import com.ryuqq.changecontrol.core.spi.StoreMetadata;
import com.ryuqq.changecontrol.core.versioning.Contribution;
import com.ryuqq.changecontrol.core.versioning.Version;
import com.ryuqq.changecontrol.core.versioning.VersionedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ChangeControlStore} for tests and reference purposes.
 *
 * <p>Containers are held as {@link VersionedObject}s, so every stored version has
 * passed the same commit checks as in the engine itself. Versions are copied on the way
 * in and on the way out; callers never share attestation lists with the store.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>containers:</strong> ConcurrentHashMap&lt;HierObjectId, VersionedObject&gt; - stored containers</li>
 *   <li><strong>contributions:</strong> ConcurrentHashMap&lt;HierObjectId, Contribution&gt; - stored contributions</li>
 *   <li><strong>metadata:</strong> ConcurrentHashMap&lt;ObjectId, MetadataEntry&gt; - per object access audit trail, with the acting party of each access</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> {@link #commitContributionSet} applies the batch to
 * working copies of the affected containers and swaps them in only when every version
 * was accepted. Mutating methods share one monitor.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Each commit rebuilds the affected containers; not suitable for large histories</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ChangeControlStore store = new InMemoryChangeControlStore();
 * HierObjectId uid = store.generateContainerId();
 * store.createContainer(new ContainerHeader(uid, ehrRef, now));
 * store.commitContributionSet(contribution, List.of(v1), null);
 * </pre>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class InMemoryChangeControlStore implements ChangeControlStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChangeControlStore.class);

    private final ConcurrentHashMap<HierObjectId, VersionedObject<Object>> containers;
    private final ConcurrentHashMap<HierObjectId, Contribution> contributions;
    private final ConcurrentHashMap<ObjectId, MetadataEntry> metadata;
    private final Clock clock;

    /**
     * Creates an empty store on the UTC system clock.
     */
    public InMemoryChangeControlStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates an empty store.
     *
     * @param clock clock used for metadata timestamps
     */
    public InMemoryChangeControlStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.containers = new ConcurrentHashMap<>();
        this.contributions = new ConcurrentHashMap<>();
        this.metadata = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Random UUIDs, re-drawn until unused by any stored object.</p>
     */
    @Override
    public synchronized HierObjectId generateContainerId(PartyProxy actor) {
        HierObjectId uid;
        do {
            uid = HierObjectId.of(UUID.randomUUID().toString());
        } while (metadata.containsKey(uid) || containers.containsKey(uid) || contributions.containsKey(uid));
        record(uid, StoreActionType.GENERATE_ID, actor, "");
        log.debug("Generated container id {}", uid);
        return uid;
    }

    @Override
    public synchronized void createContainer(ContainerHeader header, PartyProxy actor) {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (containers.containsKey(header.uid()) || contributions.containsKey(header.uid())) {
            throw new DuplicateObjectException("An object with uid " + header.uid() + " is already stored");
        }
        containers.put(header.uid(), VersionedObject.create(header.uid(), header.ownerId(), header.timeCreated()));
        record(header.uid(), StoreActionType.CREATE, actor, "owner=" + header.ownerId().id());
        log.info("Created container {} for owner {}", header.uid(), header.ownerId().id());
    }

    @Override
    public ContainerSnapshot retrieveContainer(HierObjectId uid, PartyProxy actor) {
        VersionedObject<Object> container = requireContainer(uid);
        ContainerSnapshot snapshot;
        synchronized (this) {
            snapshot = new ContainerSnapshot(container.header(), container.revisionHistory());
        }
        record(uid, StoreActionType.READ, actor, "container");
        return snapshot;
    }

    @Override
    public <T> VersionedObject<T> retrieveVersionedObject(HierObjectId uid, PartyProxy actor) {
        VersionedObject<Object> container = requireContainer(uid);
        VersionedObject<Object> copy;
        synchronized (this) {
            copy = detach(container);
        }
        record(uid, StoreActionType.READ, actor, "versioned object");
        return retype(copy);
    }

    @Override
    public <T> Version<T> retrieveVersion(ObjectVersionId versionId, PartyProxy actor) {
        if (versionId == null) {
            throw new IllegalArgumentException("versionId cannot be null");
        }
        HierObjectId uid = HierObjectId.of(versionId.objectId());
        VersionedObject<Object> container = requireContainer(uid);
        Version<T> copy;
        synchronized (this) {
            copy = InMemoryChangeControlStore.<T>retype(container).versionWithId(versionId).copy();
        }
        record(uid, StoreActionType.READ, actor, versionId.value());
        return copy;
    }

    @Override
    public Contribution retrieveContribution(HierObjectId uid, PartyProxy actor) {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        Contribution contribution = contributions.get(uid);
        if (contribution == null) {
            throw new ContributionNotFoundException("No contribution stored with uid " + uid);
        }
        record(uid, StoreActionType.READ, actor, "contribution");
        return contribution;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Verifies the batch with {@link ContributionBatch#verify}</li>
     *   <li>Replays every version on a working copy of its container</li>
     *   <li>Swaps all working copies in, then stores the contribution</li>
     * </ul>
     */
    @Override
    public synchronized void commitContributionSet(
        Contribution contribution,
        List<? extends Version<?>> versions,
        ObjectRef ownerId
    ) {
        ContributionBatch.verify(contribution, versions);
        if (contributions.containsKey(contribution.uid()) || containers.containsKey(contribution.uid())) {
            throw new DuplicateObjectException("An object with uid " + contribution.uid() + " is already stored");
        }

        Map<HierObjectId, VersionedObject<Object>> working = new LinkedHashMap<>();
        List<HierObjectId> created = new ArrayList<>();
        for (Version<?> version : versions) {
            HierObjectId uid = HierObjectId.of(version.uid().objectId());
            VersionedObject<Object> container = working.get(uid);
            if (container == null) {
                VersionedObject<Object> stored = containers.get(uid);
                if (stored != null) {
                    container = detach(stored);
                } else if (ownerId != null) {
                    container = VersionedObject.create(uid, ownerId, contribution.audit().timeCommitted());
                    created.add(uid);
                } else {
                    throw new ContainerNotFoundException(
                        "No container stored with uid " + uid + " and no owner given to create it"
                    );
                }
                working.put(uid, container);
            }
            replay(container, version);
        }

        containers.putAll(working);
        contributions.put(contribution.uid(), contribution);
        PartyProxy committer = contribution.audit().committer();
        for (HierObjectId uid : working.keySet()) {
            if (created.contains(uid)) {
                record(uid, StoreActionType.CREATE, committer, "owner=" + ownerId.id());
            }
            record(uid, StoreActionType.UPDATE, committer, "contribution=" + contribution.uid());
        }
        record(contribution.uid(), StoreActionType.CREATE, committer, "versions=" + versions.size());
        log.info("Committed contribution {} with {} version(s) across {} container(s)",
            contribution.uid(), versions.size(), working.size());
    }

    @Override
    public synchronized void addAttestation(ObjectVersionId versionId, Attestation attestation) {
        if (versionId == null) {
            throw new IllegalArgumentException("versionId cannot be null");
        }
        HierObjectId uid = HierObjectId.of(versionId.objectId());
        VersionedObject<Object> container = requireContainer(uid);
        container.commitAttestation(attestation, versionId);
        record(uid, StoreActionType.UPDATE_VERSION_ATTESTATIONS, attestation.committer(), versionId.value());
        log.info("Attested version {}", versionId);
    }

    @Override
    public StoreMetadata retrieveMetadata(ObjectId objectId, PartyProxy actor) {
        if (objectId == null) {
            throw new IllegalArgumentException("objectId cannot be null");
        }
        MetadataEntry entry = metadata.get(objectId);
        if (entry == null) {
            throw new ContainerNotFoundException("Nothing stored under id " + objectId);
        }
        entry.add(new StoreAction(StoreActionType.READ_METADATA, clock.instant(), actor, ""));
        return new StoreMetadata(entry.objectId, entry.createdAt, entry.snapshot());
    }

    private VersionedObject<Object> requireContainer(HierObjectId uid) {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        VersionedObject<Object> container = containers.get(uid);
        if (container == null) {
            throw new ContainerNotFoundException("No container stored with uid " + uid);
        }
        return container;
    }

    private static VersionedObject<Object> detach(VersionedObject<Object> container) {
        List<Version<Object>> copies = new ArrayList<>(container.versionCount());
        for (Version<Object> version : container.allVersions()) {
            copies.add(version.copy());
        }
        return VersionedObject.restore(container.header(), container.revisionHistory(), copies);
    }

    private static <T> void replay(VersionedObject<Object> container, Version<T> version) {
        VersionedObject<T> typed = retype(container);
        typed.commit(version.copy());
    }

    /**
     * Views a stored container under the payload type the caller names. Payloads are
     * stored untyped, so this is the one unchecked cast of the store.
     */
    private static <T> VersionedObject<T> retype(VersionedObject<Object> container) {
        return (VersionedObject<T>) (VersionedObject<?>) container;
    }

    private void record(ObjectId objectId, StoreActionType type, PartyProxy actor, String detail) {
        Instant now = clock.instant();
        metadata.computeIfAbsent(objectId, id -> new MetadataEntry(id, now))
            .add(new StoreAction(type, now, actor, detail));
    }

    /**
     * Creation time and action history of one stored object.
     */
    private static final class MetadataEntry {
        final ObjectId objectId;
        final Instant createdAt;
        private final List<StoreAction> actions = new ArrayList<>();

        MetadataEntry(ObjectId objectId, Instant createdAt) {
            this.objectId = objectId;
            this.createdAt = createdAt;
        }

        synchronized void add(StoreAction action) {
            actions.add(action);
        }

        synchronized List<StoreAction> snapshot() {
            return List.copyOf(actions);
        }
    }
}
