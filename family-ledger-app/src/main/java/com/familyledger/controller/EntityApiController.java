package com.familyledger.controller;

import com.familyledger.exception.ValidationException;
import com.familyledger.model.AccountContext;
import com.familyledger.model.EntityFilter;
import com.familyledger.model.EntityKind;
import com.familyledger.model.EntityRecord;
import com.familyledger.model.PurgeResult;
import com.familyledger.service.AccountService;
import com.familyledger.service.EntityStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * CRUD over every entity collection: /api/people, /api/relationships, /api/events,
 * /api/event-people, /api/media, /api/media-links, /api/sources, /api/source-links.
 */
@RestController
@RequestMapping("/api")
public class EntityApiController {

    private static final String INCLUDE_TOMBSTONED = "includeTombstoned";

    private final EntityStore entityStore;
    private final AccountService accountService;

    public EntityApiController(EntityStore entityStore, AccountService accountService) {
        this.entityStore = entityStore;
        this.accountService = accountService;
    }

    @PostMapping("/{collection}")
    public ResponseEntity<Map<String, Object>> create(@AuthenticationPrincipal UserDetails user,
                                                      @PathVariable String collection,
                                                      @RequestBody Map<String, Object> body) {
        AccountContext ctx = accountService.contextFor(user.getUsername());
        EntityKind kind = EntityKind.fromPath(collection);
        long id = entityStore.create(ctx, kind, body);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(toBody(entityStore.get(ctx, kind, id)));
    }

    @GetMapping("/{collection}")
    public List<Map<String, Object>> list(@AuthenticationPrincipal UserDetails user,
                                          @PathVariable String collection,
                                          @RequestParam Map<String, String> params) {
        AccountContext ctx = accountService.contextFor(user.getUsername());
        EntityKind kind = EntityKind.fromPath(collection);

        EntityFilter filter = Boolean.parseBoolean(params.get(INCLUDE_TOMBSTONED))
            ? EntityFilter.withTombstoned() : EntityFilter.live();
        for (Map.Entry<String, String> param : new TreeMap<>(params).entrySet()) {
            if (!INCLUDE_TOMBSTONED.equals(param.getKey())) {
                filter = filter.and(param.getKey(), param.getValue());
            }
        }
        return entityStore.list(ctx, kind, filter).stream().map(EntityApiController::toBody).toList();
    }

    @GetMapping("/{collection}/{id}")
    public Map<String, Object> get(@AuthenticationPrincipal UserDetails user,
                                   @PathVariable String collection,
                                   @PathVariable long id,
                                   @RequestParam(defaultValue = "false") boolean includeTombstoned) {
        AccountContext ctx = accountService.contextFor(user.getUsername());
        return toBody(entityStore.get(ctx, EntityKind.fromPath(collection), id, includeTombstoned));
    }

    /** Partial update. An If-Match header carrying the expected version makes it conditional. */
    @PatchMapping("/{collection}/{id}")
    public Map<String, Object> update(@AuthenticationPrincipal UserDetails user,
                                      @PathVariable String collection,
                                      @PathVariable long id,
                                      @RequestHeader(value = "If-Match", required = false) String ifMatch,
                                      @RequestBody Map<String, Object> body) {
        AccountContext ctx = accountService.contextFor(user.getUsername());
        EntityKind kind = EntityKind.fromPath(collection);
        long version = entityStore.update(ctx, kind, id, body, parseVersion(ifMatch));
        return Map.of("id", id, "version", version);
    }

    @DeleteMapping("/{collection}/{id}")
    public ResponseEntity<Void> softDelete(@AuthenticationPrincipal UserDetails user,
                                           @PathVariable String collection,
                                           @PathVariable long id) {
        AccountContext ctx = accountService.contextFor(user.getUsername());
        entityStore.softDelete(ctx, EntityKind.fromPath(collection), id);
        return ResponseEntity.noContent().build();
    }

    /** Irreversible. Requires confirm=true so it is never reached by a plain DELETE. */
    @DeleteMapping("/{collection}/{id}/purge")
    public Map<String, Object> purge(@AuthenticationPrincipal UserDetails user,
                                     @PathVariable String collection,
                                     @PathVariable long id,
                                     @RequestParam(defaultValue = "false") boolean confirm) {
        if (!confirm) {
            throw new ValidationException("Hard purge is irreversible; repeat with confirm=true");
        }
        AccountContext ctx = accountService.contextFor(user.getUsername());
        PurgeResult result = entityStore.purge(ctx, EntityKind.fromPath(collection), id);
        return Map.of(
            "purged", result.target().toString(),
            "removed", result.removed().stream().map(Object::toString).toList()
        );
    }

    static Map<String, Object> toBody(EntityRecord record) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", record.id());
        body.put("kind", record.kind().key());
        body.put("version", record.version());
        body.put("deleted", record.deleted());
        body.putAll(record.fields());
        body.put("createdAt", record.createdAt());
        body.put("updatedAt", record.updatedAt());
        return body;
    }

    private static Long parseVersion(String ifMatch) {
        if (ifMatch == null || ifMatch.isBlank()) {
            return null;
        }
        String value = ifMatch.trim().replace("\"", "");
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("If-Match must carry a numeric version, got " + ifMatch);
        }
    }
}
