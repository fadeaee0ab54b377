package com.bank.p2pfraud.seeder;

import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.AccountStatus;
import com.bank.p2pfraud.repository.AccountRepository;
import com.bank.p2pfraud.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Seeds the default fraud policy and the demo accounts for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Accounts already present are left untouched, so seeding twice is harmless.
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private final AccountRepository accountRepository;
    private final SettingsService settingsService;
    private final Clock clock;

    public DataSeeder(AccountRepository accountRepository,
                      SettingsService settingsService,
                      Clock clock) {
        this.accountRepository = accountRepository;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting data seeding ===");

        settingsService.initializeDefaults();
        int created = seedAccounts();

        log.info("=== Data seeding complete: {} demo accounts created ===", created);
    }

    int seedAccounts() {
        int created = 0;
        for (Account account : demoAccounts()) {
            if (accountRepository.create(account)) {
                log.info("Seeded {} {} ({}) balance={}", account.getRole(), account.getAccountId(),
                        account.getEmail(), account.getBalance());
                created++;
            } else {
                log.info("Account {} already exists, skipping", account.getAccountId());
            }
        }
        return created;
    }

    List<Account> demoAccounts() {
        long now = clock.millis();
        return List.of(
                demo("USR-0001", "System Admin", "admin@fraud-detect.local", AccountRole.ADMIN, 0.0, now),
                demo("USR-0002", "Fraud Investigator", "investigator@fraud-detect.local",
                        AccountRole.INVESTIGATOR, 0.0, now),
                demo("USR-0003", "John Customer", "user@fraud-detect.local", AccountRole.CUSTOMER, 10000.0, now),
                demo("USR-0004", "Jane Smith", "jane@fraud-detect.local", AccountRole.CUSTOMER, 8000.0, now),
                demo("USR-0005", "Bob Wilson", "bob@fraud-detect.local", AccountRole.CUSTOMER, 5000.0, now)
        );
    }

    private static Account demo(String id, String name, String email, AccountRole role, double balance, long now) {
        return Account.builder()
                .accountId(id)
                .name(name)
                .email(email)
                .role(role)
                .status(AccountStatus.APPROVED)
                .balance(balance)
                .createdAt(now)
                .build();
    }
}
