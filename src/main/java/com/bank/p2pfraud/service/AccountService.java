package com.bank.p2pfraud.service;

import com.bank.p2pfraud.exception.InvalidTransitionException;
import com.bank.p2pfraud.exception.NotFoundException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.AccountStatus;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.repository.AccountRepository;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final SettingsService settingsService;
    private final AuditLogService auditLogService;
    private final Retry registrationRetry;
    private final Clock clock;

    public AccountService(AccountRepository accountRepository,
                          SettingsService settingsService,
                          AuditLogService auditLogService,
                          @Qualifier("registrationRetry") Retry registrationRetry,
                          Clock clock) {
        this.accountRepository = accountRepository;
        this.settingsService = settingsService;
        this.auditLogService = auditLogService;
        this.registrationRetry = registrationRetry;
        this.clock = clock;
    }

    /**
     * Create a PENDING account with a zero balance.
     *
     * Storage contention is retried with backoff. Email uniqueness is checked
     * again before every attempt, so a retry never creates a duplicate.
     */
    public Account register(CallerContext caller, String name, String email, AccountRole role) {
        caller.requireRole(AccountRole.ADMIN);
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        if (email == null || !email.contains("@")) {
            throw new ValidationException("a valid email is required");
        }
        if (role == null) {
            throw new ValidationException("role is required");
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);

        Account created = Retry.decorateSupplier(registrationRetry, () -> {
            if (accountRepository.findByEmail(normalizedEmail) != null) {
                throw new ValidationException("Email already registered: " + normalizedEmail);
            }
            Account account = Account.builder()
                    .accountId("USR-" + UUID.randomUUID().toString().substring(0, 8))
                    .name(name.trim())
                    .email(normalizedEmail)
                    .role(role)
                    .status(AccountStatus.PENDING)
                    .balance(0.0)
                    .createdAt(clock.millis())
                    .build();
            if (!accountRepository.create(account)) {
                throw new ValidationException("Account id collision, please retry");
            }
            return account;
        }).get();

        log.info("Registered account {} ({}) as {}", created.getAccountId(), created.getEmail(), role);
        auditLogService.record(caller.callerId(), "register_user", AuditLogService.ENTITY_USER,
                created.getAccountId(), "role=" + role);
        return created;
    }

    /**
     * PENDING -> APPROVED, granting the configured default balance.
     */
    public Account approve(CallerContext caller, String accountId) {
        caller.requireRole(AccountRole.ADMIN);
        Account account = requirePending(accountId);

        double balance = settingsService.getSettings().getDefaultUserBalance();
        accountRepository.updateStatus(accountId, AccountStatus.APPROVED, balance);
        account.setStatus(AccountStatus.APPROVED);
        account.setBalance(balance);

        log.info("Account {} approved by {} with balance {}", accountId, caller.callerId(), balance);
        auditLogService.record(caller.callerId(), "approve_user", AuditLogService.ENTITY_USER, accountId,
                String.format("balance=%.2f", balance));
        return account;
    }

    public Account reject(CallerContext caller, String accountId) {
        caller.requireRole(AccountRole.ADMIN);
        Account account = requirePending(accountId);

        accountRepository.updateStatus(accountId, AccountStatus.REJECTED, account.getBalance());
        account.setStatus(AccountStatus.REJECTED);

        log.info("Account {} rejected by {}", accountId, caller.callerId());
        auditLogService.record(caller.callerId(), "reject_user", AuditLogService.ENTITY_USER, accountId, null);
        return account;
    }

    public Account getAccount(String accountId) {
        Account account = accountRepository.findById(accountId);
        if (account == null) {
            throw new NotFoundException("Account not found: " + accountId);
        }
        return account;
    }

    public List<Account> listPending(CallerContext caller) {
        caller.requireRole(AccountRole.ADMIN);
        return accountRepository.findByStatus(AccountStatus.PENDING);
    }

    private Account requirePending(String accountId) {
        Account account = getAccount(accountId);
        if (account.getStatus() != AccountStatus.PENDING) {
            throw new InvalidTransitionException(
                    "Account " + accountId + " is " + account.getStatus() + ", expected PENDING");
        }
        return account;
    }
}
