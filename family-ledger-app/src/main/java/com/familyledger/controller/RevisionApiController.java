package com.familyledger.controller;

import com.familyledger.exception.NotFoundException;
import com.familyledger.exception.ValidationException;
import com.familyledger.model.AccountContext;
import com.familyledger.model.EntityKind;
import com.familyledger.model.RecordSnapshot;
import com.familyledger.model.Revision;
import com.familyledger.model.RevisionQuery;
import com.familyledger.service.AccountService;
import com.familyledger.service.RevisionLedger;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Read-only audit surface over the revision ledger.
 */
@RestController
@RequestMapping("/api/revisions")
public class RevisionApiController {

    private final RevisionLedger revisionLedger;
    private final AccountService accountService;

    public RevisionApiController(RevisionLedger revisionLedger, AccountService accountService) {
        this.revisionLedger = revisionLedger;
        this.accountService = accountService;
    }

    @GetMapping
    public List<Revision> query(@AuthenticationPrincipal UserDetails user,
                                @RequestParam(required = false) String kind,
                                @RequestParam(required = false) Long entityId,
                                @RequestParam(required = false) String from,
                                @RequestParam(required = false) String to) {
        AccountContext ctx = accountService.contextFor(user.getUsername());
        RevisionQuery query = new RevisionQuery(
            kind != null ? EntityKind.fromKey(kind) : null,
            entityId,
            parseInstant("from", from),
            parseInstant("to", to)
        );
        return revisionLedger.query(ctx, query);
    }

    @GetMapping("/{kind}/{id}")
    public List<Revision> history(@AuthenticationPrincipal UserDetails user,
                                  @PathVariable String kind,
                                  @PathVariable long id) {
        AccountContext ctx = accountService.contextFor(user.getUsername());
        return revisionLedger.history(ctx, EntityKind.fromKey(kind), id);
    }

    @GetMapping("/{kind}/{id}/as-of")
    public RecordSnapshot asOf(@AuthenticationPrincipal UserDetails user,
                               @PathVariable String kind,
                               @PathVariable long id,
                               @RequestParam String at) {
        AccountContext ctx = accountService.contextFor(user.getUsername());
        Instant asOf = parseInstant("at", at);
        return revisionLedger.reconstruct(ctx, EntityKind.fromKey(kind), id, asOf)
            .orElseThrow(() -> new NotFoundException(kind + " " + id + " did not exist at " + asOf));
    }

    private static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("'" + name + "' must be an ISO-8601 instant, got " + value);
        }
    }
}
