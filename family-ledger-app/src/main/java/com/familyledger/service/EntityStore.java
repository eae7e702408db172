package com.familyledger.service;

import com.familyledger.exception.ConflictException;
import com.familyledger.exception.ForbiddenException;
import com.familyledger.exception.NotFoundException;
import com.familyledger.exception.ValidationException;
import com.familyledger.model.AccountContext;
import com.familyledger.model.EntityFilter;
import com.familyledger.model.EntityKind;
import com.familyledger.model.EntityRecord;
import com.familyledger.model.EntityRef;
import com.familyledger.model.FieldChange;
import com.familyledger.model.FieldSpec;
import com.familyledger.model.Privacy;
import com.familyledger.model.PurgeResult;
import com.familyledger.model.RevisionOperation;
import com.familyledger.repository.AccountRepository;
import com.familyledger.repository.EntityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The entry point for every read and write of genealogy records.
 *
 * <p>Each mutation is one {@link UnitOfWork}: validate the patch, check graph invariants,
 * write the row and append the revision. Any failure along the way leaves no trace.
 * Writes that reference other records, tombstones and purges first take the account lock, so
 * a reference check never races the tombstone or purge of what it points at, and acyclicity
 * checks within one account never race each other.
 */
@Service
public class EntityStore {

    private static final Logger log = LoggerFactory.getLogger(EntityStore.class);

    private final EntityRepository entityRepository;
    private final AccountRepository accountRepository;
    private final GraphInvariantChecker invariantChecker;
    private final CascadeResolver cascadeResolver;
    private final RevisionLedger revisionLedger;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public EntityStore(EntityRepository entityRepository,
                       AccountRepository accountRepository,
                       GraphInvariantChecker invariantChecker,
                       CascadeResolver cascadeResolver,
                       RevisionLedger revisionLedger,
                       UnitOfWork unitOfWork,
                       Clock clock) {
        this.entityRepository = entityRepository;
        this.accountRepository = accountRepository;
        this.invariantChecker = invariantChecker;
        this.cascadeResolver = cascadeResolver;
        this.revisionLedger = revisionLedger;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    // ========== WRITES ==========

    /**
     * Creates a record from a full set of fields.
     *
     * @return the new record's id
     */
    public long create(AccountContext ctx, EntityKind kind, Map<String, ?> fields) {
        Map<String, Object> state = withoutNulls(normalize(kind, fields));
        applyDefaults(kind, state);
        requireMandatoryFields(kind, state);

        return unitOfWork.write(() -> {
            if (referencesOthers(kind)) {
                accountRepository.lockForUpdate(ctx.accountId());
            }
            Map<String, Object> checked = invariantChecker.check(ctx, kind, state, null);
            Instant now = clock.instant();
            long id = entityRepository.insert(kind, ctx.accountId(), checked, now);
            revisionLedger.append(ctx, kind, id, RevisionOperation.CREATE, Diffs.between(kind, Map.of(), checked), now);
            log.debug("Created {} {} in account {}", kind.key(), id, ctx.accountId());
            return id;
        });
    }

    /**
     * Applies a partial patch; a null value clears an optional field.
     *
     * @return the record's version after the update
     */
    public long update(AccountContext ctx, EntityKind kind, long id, Map<String, ?> patch) {
        return update(ctx, kind, id, patch, null);
    }

    /**
     * Applies a partial patch if the record is still at {@code expectedVersion}.
     *
     * @param expectedVersion null to skip the version check
     * @throws ConflictException if the record is tombstoned or at another version
     */
    public long update(AccountContext ctx, EntityKind kind, long id, Map<String, ?> patch, Long expectedVersion) {
        Map<String, Object> changes = normalize(kind, patch);

        return unitOfWork.write(() -> {
            if (referencesOthers(kind)) {
                accountRepository.lockForUpdate(ctx.accountId());
            }
            EntityRecord current = entityRepository.findByIdForUpdate(kind, id)
                .orElseThrow(() -> notFound(kind, id));
            requireOwner(ctx, current);
            if (current.deleted()) {
                throw new ConflictException(kind.key() + " " + id + " has been deleted");
            }
            if (!cascadeResolver.isLive(current)) {
                throw notFound(kind, id);
            }
            if (expectedVersion != null && expectedVersion != current.version()) {
                throw new ConflictException(kind.key() + " " + id + " is at version " + current.version()
                    + ", not " + expectedVersion);
            }

            Map<String, Object> merged = new HashMap<>(current.fields());
            merged.putAll(changes);
            merged = withoutNulls(merged);
            requireMandatoryFields(kind, merged);
            Map<String, Object> checked = invariantChecker.check(ctx, kind, merged, current);

            Map<String, FieldChange> diff = Diffs.between(kind, current.fields(), checked);
            if (diff.isEmpty()) {
                return current.version();
            }
            Map<String, Object> columns = new HashMap<>();
            for (String field : diff.keySet()) {
                columns.put(field, checked.get(field));
            }
            Instant now = clock.instant();
            if (entityRepository.update(kind, id, current.version(), columns, now) == 0) {
                throw new ConflictException(kind.key() + " " + id + " changed concurrently");
            }
            revisionLedger.append(ctx, kind, id, RevisionOperation.UPDATE, diff, now);
            return current.version() + 1;
        });
    }

    /**
     * Tombstones a record. Dependents are left in place and drop out of live reads.
     */
    public void softDelete(AccountContext ctx, EntityKind kind, long id) {
        unitOfWork.writeVoid(() -> {
            accountRepository.lockForUpdate(ctx.accountId());
            EntityRecord current = entityRepository.findByIdForUpdate(kind, id)
                .orElseThrow(() -> notFound(kind, id));
            requireOwner(ctx, current);
            if (!cascadeResolver.isLive(current)) {
                throw notFound(kind, id);
            }
            Instant now = clock.instant();
            if (entityRepository.markDeleted(kind, id, current.version(), now) == 0) {
                throw new ConflictException(kind.key() + " " + id + " changed concurrently");
            }
            revisionLedger.append(ctx, kind, id, RevisionOperation.SOFT_DELETE, Diffs.tombstone(), now);
            log.info("Tombstoned {} {} in account {}", kind.key(), id, ctx.accountId());
        });
    }

    /**
     * Hard purge: physically removes the record and every dependent that cannot exist without
     * it, tombstoned or not. Irreversible. Revisions are kept, and each removed row gets a
     * purge revision.
     */
    public PurgeResult purge(AccountContext ctx, EntityKind kind, long id) {
        return unitOfWork.write(() -> {
            accountRepository.lockForUpdate(ctx.accountId());
            EntityRecord target = entityRepository.findByIdForUpdate(kind, id)
                .orElseThrow(() -> notFound(kind, id));
            requireOwner(ctx, target);

            Instant now = clock.instant();
            for (EntityRecord event : cascadeResolver.attributionsOf(target)) {
                Map<String, Object> detached = new HashMap<>(event.fields());
                detached.remove("createdBy");
                entityRepository.clearReference(EntityKind.EVENT, event.id(), "createdBy", now);
                revisionLedger.append(ctx, EntityKind.EVENT, event.id(), RevisionOperation.UPDATE,
                    Diffs.between(EntityKind.EVENT, event.fields(), detached), now);
            }

            List<EntityRecord> plan = cascadeResolver.purgePlan(target);
            for (EntityRecord record : plan) {
                entityRepository.delete(record.kind(), record.id());
                revisionLedger.append(ctx, record.kind(), record.id(), RevisionOperation.PURGE,
                    Diffs.purge(record.kind(), record.fields()), now);
            }
            List<EntityRef> removed = plan.stream().map(EntityRecord::ref).toList();
            log.info("Purged {} {} in account {} with {} dependent rows", kind.key(), id, ctx.accountId(),
                removed.size() - 1);
            return new PurgeResult(target.ref(), removed);
        });
    }

    // ========== READS ==========

    public EntityRecord get(AccountContext ctx, EntityKind kind, long id) {
        return get(ctx, kind, id, false);
    }

    /**
     * @param includeTombstoned also return tombstoned and dangling-soft records, for history views
     */
    public EntityRecord get(AccountContext ctx, EntityKind kind, long id, boolean includeTombstoned) {
        return unitOfWork.read(() -> {
            EntityRecord record = entityRepository.findById(kind, id).orElseThrow(() -> notFound(kind, id));
            requireOwner(ctx, record);
            if (includeTombstoned) {
                return record;
            }
            CascadeResolver.Liveness liveness = cascadeResolver.newLiveness();
            if (!liveness.isLive(record)) {
                throw notFound(kind, id);
            }
            return liveness.liveView(record);
        });
    }

    public Optional<EntityRecord> find(AccountContext ctx, EntityKind kind, long id) {
        try {
            return Optional.of(get(ctx, kind, id));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    /** Records of the caller's account matching the filter, ordered by id. */
    public List<EntityRecord> list(AccountContext ctx, EntityKind kind, EntityFilter filter) {
        Map<String, Object> matches = new LinkedHashMap<>();
        filter.matches().forEach((field, value) -> matches.put(field, kind.requireField(field).normalize(value)));

        return unitOfWork.read(() -> {
            List<EntityRecord> rows = entityRepository.findByAccount(kind, ctx.accountId(), matches,
                filter.includeTombstoned());
            if (filter.includeTombstoned()) {
                return rows;
            }
            CascadeResolver.Liveness liveness = cascadeResolver.newLiveness();
            return rows.stream().filter(liveness::isLive).map(liveness::liveView).toList();
        });
    }

    // ========== HELPERS ==========

    private static Map<String, Object> normalize(EntityKind kind, Map<String, ?> input) {
        if (input == null) {
            throw new ValidationException("A field map is required");
        }
        Map<String, Object> normalized = new HashMap<>();
        input.forEach((name, raw) -> normalized.put(name, kind.requireField(name).normalize(raw)));
        return normalized;
    }

    private static boolean referencesOthers(EntityKind kind) {
        return !kind.references().isEmpty() || kind.hasGenericTarget() || !kind.attributions().isEmpty();
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> fields) {
        Map<String, Object> result = new HashMap<>();
        fields.forEach((name, value) -> {
            if (value != null) {
                result.put(name, value);
            }
        });
        return result;
    }

    private static void applyDefaults(EntityKind kind, Map<String, Object> state) {
        if (kind == EntityKind.PERSON) {
            state.putIfAbsent("privacy", Privacy.PRIVATE.value());
        }
    }

    private static void requireMandatoryFields(EntityKind kind, Map<String, Object> state) {
        for (FieldSpec spec : kind.fields()) {
            Object value = state.get(spec.name());
            if (spec.required() && (value == null || (value instanceof String s && s.isBlank()))) {
                throw new ValidationException("Field '" + spec.name() + "' is required for " + kind.key());
            }
        }
    }

    private static void requireOwner(AccountContext ctx, EntityRecord record) {
        if (record.accountId() != ctx.accountId()) {
            throw new ForbiddenException(record.kind().key() + " " + record.id() + " belongs to another account");
        }
    }

    private static NotFoundException notFound(EntityKind kind, long id) {
        return new NotFoundException(kind.key() + " " + id + " not found");
    }
}
