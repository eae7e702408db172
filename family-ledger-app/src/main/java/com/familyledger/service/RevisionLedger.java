package com.familyledger.service;

import com.familyledger.exception.ForbiddenException;
import com.familyledger.exception.NotFoundException;
import com.familyledger.model.AccountContext;
import com.familyledger.model.EntityKind;
import com.familyledger.model.FieldChange;
import com.familyledger.model.FieldSpec;
import com.familyledger.model.RecordSnapshot;
import com.familyledger.model.Revision;
import com.familyledger.model.RevisionOperation;
import com.familyledger.model.RevisionQuery;
import com.familyledger.repository.RevisionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only history of every committed mutation, bound to the storage handle of its
 * repository and injected into the entity store.
 *
 * <p>{@link #append} runs inside the caller's transaction: if it fails, the mutation it
 * describes rolls back with it. Reads are account-scoped and ordered by commit order.
 */
@Service
public class RevisionLedger {

    private static final Logger log = LoggerFactory.getLogger(RevisionLedger.class);

    private final RevisionRepository revisionRepository;
    private final UnitOfWork unitOfWork;

    public RevisionLedger(RevisionRepository revisionRepository, UnitOfWork unitOfWork) {
        this.revisionRepository = revisionRepository;
        this.unitOfWork = unitOfWork;
    }

    /**
     * Records one mutation. The only write the ledger offers.
     *
     * @param diff changed fields only; may be empty only for a create or purge of a record
     *             with no field values
     */
    public Revision append(AccountContext ctx, EntityKind kind, long entityId, RevisionOperation operation,
                           Map<String, FieldChange> diff, Instant recordedAt) {
        if (diff.isEmpty() && (operation == RevisionOperation.UPDATE || operation == RevisionOperation.SOFT_DELETE)) {
            throw new IllegalArgumentException("Refusing to record an empty diff for " + kind.key() + " " + entityId);
        }
        Revision draft = new Revision(null, ctx.accountId(), kind, entityId, operation, ctx.author(), diff, recordedAt);
        long id = revisionRepository.insert(draft);
        log.debug("Revision {}: {} {} {} by {}", id, operation.value(), kind.key(), entityId, ctx.author());
        return new Revision(id, draft.accountId(), kind, entityId, operation, draft.author(), diff, recordedAt);
    }

    /** All revisions of one entity in commit order, including those after a tombstone or purge. */
    public List<Revision> history(AccountContext ctx, EntityKind kind, long entityId) {
        return unitOfWork.read(() -> {
            List<Revision> revisions = revisionRepository.find(ctx.accountId(), RevisionQuery.forEntity(kind, entityId));
            if (revisions.isEmpty()) {
                requireNoForeignHistory(ctx, kind, entityId);
            }
            return revisions;
        });
    }

    /** Audit query over the caller's account. */
    public List<Revision> query(AccountContext ctx, RevisionQuery query) {
        return unitOfWork.read(() -> revisionRepository.find(ctx.accountId(), query));
    }

    /**
     * Folds an entity's revisions up to and including {@code asOf}. The result equals what a
     * direct read returned at that moment: same fields, same version, same tombstone flag.
     *
     * @return empty when the entity did not exist yet at {@code asOf}
     */
    public Optional<RecordSnapshot> reconstruct(AccountContext ctx, EntityKind kind, long entityId, Instant asOf) {
        List<Revision> revisions = history(ctx, kind, entityId);
        if (revisions.isEmpty()) {
            throw new NotFoundException(kind.key() + " " + entityId + " has no history");
        }
        return replay(kind, entityId, revisions, asOf);
    }

    static Optional<RecordSnapshot> replay(EntityKind kind, long entityId, List<Revision> revisions, Instant asOf) {
        Map<String, Object> fields = new HashMap<>();
        long version = 0;
        boolean deleted = false;
        boolean purged = false;

        for (Revision revision : revisions) {
            if (revision.recordedAt().isAfter(asOf)) {
                break;
            }
            version++;
            if (revision.operation() == RevisionOperation.PURGE) {
                fields.clear();
                purged = true;
                continue;
            }
            for (Map.Entry<String, FieldChange> change : revision.diff().entrySet()) {
                if (Revision.DELETED_FIELD.equals(change.getKey())) {
                    deleted = Boolean.TRUE.equals(change.getValue().after());
                    continue;
                }
                FieldSpec spec = kind.requireField(change.getKey());
                Object value = spec.type().fromJson(change.getValue().after());
                if (value == null) {
                    fields.remove(spec.name());
                } else {
                    fields.put(spec.name(), value);
                }
            }
        }
        if (version == 0) {
            return Optional.empty();
        }
        return Optional.of(new RecordSnapshot(kind, entityId, Map.copyOf(fields), version, deleted, purged, asOf));
    }

    private void requireNoForeignHistory(AccountContext ctx, EntityKind kind, long entityId) {
        List<Long> owners = revisionRepository.findOwningAccounts(kind, entityId);
        if (!owners.isEmpty() && !owners.contains(ctx.accountId())) {
            throw new ForbiddenException(kind.key() + " " + entityId + " belongs to another account");
        }
    }
}
