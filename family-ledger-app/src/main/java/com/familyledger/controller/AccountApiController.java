package com.familyledger.controller;

import com.familyledger.exception.ValidationException;
import com.familyledger.repository.HealthRepository;
import com.familyledger.service.AccountService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class AccountApiController {

    private static final Logger log = LoggerFactory.getLogger(AccountApiController.class);

    private final AccountService accountService;
    private final HealthRepository healthRepository;

    public AccountApiController(AccountService accountService, HealthRepository healthRepository) {
        this.accountService = accountService;
        this.healthRepository = healthRepository;
    }

    @PostMapping("/accounts")
    public ResponseEntity<Map<String, Object>> register(@RequestBody Map<String, Object> body) {
        String username = stringField(body, "username");
        long id = accountService.register(username, stringField(body, "password"), stringField(body, "displayName"));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id, "username", username));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        try {
            healthRepository.ping();
            return ResponseEntity.ok(Map.of("status", "healthy", "database", "connected"));
        } catch (DataAccessException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", "unhealthy", "database", "disconnected"));
        }
    }

    private static String stringField(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new ValidationException("Field '" + field + "' must be a string");
    }
}
