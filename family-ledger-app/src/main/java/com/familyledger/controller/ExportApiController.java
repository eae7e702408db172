package com.familyledger.controller;

import com.familyledger.service.AccountService;
import com.familyledger.service.ExportService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ExportApiController {

    private final ExportService exportService;
    private final AccountService accountService;

    public ExportApiController(ExportService exportService, AccountService accountService) {
        this.exportService = exportService;
        this.accountService = accountService;
    }

    @GetMapping("/api/export")
    public ResponseEntity<String> export(@AuthenticationPrincipal UserDetails user) {
        String json = exportService.exportJson(accountService.contextFor(user.getUsername()));
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(json);
    }
}
