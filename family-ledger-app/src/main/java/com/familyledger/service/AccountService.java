package com.familyledger.service;

import com.familyledger.config.AccountSecurityConfig;
import com.familyledger.exception.ConflictException;
import com.familyledger.exception.ForbiddenException;
import com.familyledger.exception.ValidationException;
import com.familyledger.model.Account;
import com.familyledger.model.AccountContext;
import com.familyledger.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final UnitOfWork unitOfWork;
    private final AccountSecurityConfig config;
    private final Clock clock;

    public AccountService(AccountRepository accountRepository, PasswordEncoder passwordEncoder,
                          UnitOfWork unitOfWork, AccountSecurityConfig config, Clock clock) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.unitOfWork = unitOfWork;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Registers a new account, the tenant boundary for everything it later creates.
     *
     * @return the new account's id
     */
    public long register(String username, String rawPassword, String displayName) {
        if (username == null || !username.matches("[A-Za-z0-9._-]{3,100}")) {
            throw new ValidationException("Username must be 3-100 letters, digits, '.', '_' or '-'");
        }
        if (rawPassword == null || rawPassword.length() < config.getMinPasswordLength()) {
            throw new ValidationException("Password must be at least " + config.getMinPasswordLength() + " characters");
        }
        if (displayName != null && displayName.length() > 200) {
            throw new ValidationException("Display name must be at most 200 characters");
        }
        String hash = passwordEncoder.encode(rawPassword);

        return unitOfWork.write(() -> {
            if (accountRepository.findByUsername(username).isPresent()) {
                throw new ConflictException("Username '" + username + "' is taken");
            }
            long id = accountRepository.save(username, hash, displayName, clock.instant());
            log.info("Registered account {} ({})", id, username);
            return id;
        });
    }

    /** The engine context for an already authenticated user. */
    public AccountContext contextFor(String username) {
        Account account = unitOfWork.read(() -> accountRepository.findByUsername(username))
            .orElseThrow(() -> new ForbiddenException("No account for user '" + username + "'"));
        return new AccountContext(account.id(), account.username());
    }
}
