package com.familyledger.controller;

import com.familyledger.model.AccountContext;
import com.familyledger.model.AncestryEntry;
import com.familyledger.model.Event;
import com.familyledger.model.Person;
import com.familyledger.service.AccountService;
import com.familyledger.service.GraphTraversalService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/people/{id}")
public class PersonGraphApiController {

    private final GraphTraversalService traversalService;
    private final AccountService accountService;

    public PersonGraphApiController(GraphTraversalService traversalService, AccountService accountService) {
        this.traversalService = traversalService;
        this.accountService = accountService;
    }

    @GetMapping("/ancestors")
    public List<AncestryEntry> ancestors(@AuthenticationPrincipal UserDetails user,
                                         @PathVariable long id,
                                         @RequestParam(required = false) Integer maxDepth) {
        return traversalService.ancestors(context(user), id, maxDepth);
    }

    @GetMapping("/descendants")
    public List<AncestryEntry> descendants(@AuthenticationPrincipal UserDetails user,
                                           @PathVariable long id,
                                           @RequestParam(required = false) Integer maxDepth) {
        return traversalService.descendants(context(user), id, maxDepth);
    }

    @GetMapping("/parents")
    public List<Person> parents(@AuthenticationPrincipal UserDetails user, @PathVariable long id) {
        return traversalService.parents(context(user), id);
    }

    @GetMapping("/children")
    public List<Person> children(@AuthenticationPrincipal UserDetails user, @PathVariable long id) {
        return traversalService.children(context(user), id);
    }

    @GetMapping("/spouses")
    public List<Person> spouses(@AuthenticationPrincipal UserDetails user, @PathVariable long id) {
        return traversalService.spouses(context(user), id);
    }

    @GetMapping("/siblings")
    public List<Person> siblings(@AuthenticationPrincipal UserDetails user, @PathVariable long id) {
        return traversalService.siblings(context(user), id);
    }

    @GetMapping("/timeline")
    public List<Event> timeline(@AuthenticationPrincipal UserDetails user, @PathVariable long id) {
        return traversalService.timeline(context(user), id);
    }

    private AccountContext context(UserDetails user) {
        return accountService.contextFor(user.getUsername());
    }
}
