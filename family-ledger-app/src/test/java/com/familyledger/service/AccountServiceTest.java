package com.familyledger.service;

import com.familyledger.exception.ConflictException;
import com.familyledger.exception.ForbiddenException;
import com.familyledger.exception.ValidationException;
import com.familyledger.model.Account;
import com.familyledger.model.AccountContext;
import com.familyledger.repository.AccountRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = {"/reset.sql", "/accounts.sql"}, executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class AccountServiceTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        void storesHashedPassword() {
            long id = accountService.register("carol", "s3cret-pass", "Carol");

            Account account = accountRepository.findById(id).orElseThrow();
            assertThat(account.username()).isEqualTo("carol");
            assertThat(account.displayName()).isEqualTo("Carol");
            assertThat(account.passwordHash()).isNotEqualTo("s3cret-pass");
            assertThat(passwordEncoder.matches("s3cret-pass", account.passwordHash())).isTrue();
        }

        @Test
        void rejectsTakenUsername() {
            assertThatThrownBy(() -> accountService.register("alice", "s3cret-pass", null))
                .isInstanceOf(ConflictException.class);
        }

        @Test
        void rejectsShortPassword() {
            assertThatThrownBy(() -> accountService.register("carol", "abc", null))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void rejectsMalformedUsername() {
            assertThatThrownBy(() -> accountService.register("carol smith", "s3cret-pass", null))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> accountService.register(null, "s3cret-pass", null))
                .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("contextFor")
    class ContextFor {

        @Test
        void resolvesAccountIdAndAuthor() {
            AccountContext ctx = accountService.contextFor("bob");

            assertThat(ctx.accountId()).isEqualTo(2000L);
            assertThat(ctx.author()).isEqualTo("bob");
        }

        @Test
        void unknownUserIsForbidden() {
            assertThatThrownBy(() -> accountService.contextFor("mallory"))
                .isInstanceOf(ForbiddenException.class);
        }
    }
}
