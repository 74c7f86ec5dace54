package com.ecotech.auth.api.console;

import com.ecotech.airquality.client.AirQualityClient;
import com.ecotech.airquality.client.AirQualityException;
import com.ecotech.airquality.model.AirQualityReport;
import com.ecotech.auth.api.console.ConsoleIO.EndOfInputException;
import com.ecotech.auth.domain.exception.AccountException;
import com.ecotech.auth.domain.exception.AccountLockedException;
import com.ecotech.auth.domain.exception.InvalidCredentialsException;
import com.ecotech.auth.domain.exception.ValidationException;
import com.ecotech.auth.domain.model.Account;
import com.ecotech.auth.domain.model.Role;
import com.ecotech.auth.domain.service.AccountManager;
import com.ecotech.auth.domain.service.AuthenticationSession;
import com.ecotech.auth.domain.service.AuthenticationSessionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Interactive console: login, account administration and air quality lookups.
 * Runs once at startup; the exit code is 0 after a normal exit and 1 when storage
 * is unreachable or the login budget is exhausted.
 */
@Component
@ConditionalOnProperty(name = "ecotech.console.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class EcotechConsole implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String RULE = "=".repeat(60);
    private static final String TABLE_FORMAT = "%-5s %-20s %-30s %-8s%n";

    private final AccountManager accountManager;
    private final AuthenticationSessionFactory sessionFactory;
    private final AirQualityClient airQualityClient;
    private final AirQualityView airQualityView;
    private final ConsoleExceptionHandler exceptionHandler;
    private final ConsoleIO io;

    private int exitCode = EXIT_OK;

    public EcotechConsole(AccountManager accountManager,
                          AuthenticationSessionFactory sessionFactory,
                          AirQualityClient airQualityClient,
                          AirQualityView airQualityView,
                          ConsoleExceptionHandler exceptionHandler,
                          ConsoleIO io) {
        this.accountManager = accountManager;
        this.sessionFactory = sessionFactory;
        this.airQualityClient = airQualityClient;
        this.airQualityView = airQualityView;
        this.exceptionHandler = exceptionHandler;
        this.io = io;
    }

    @Override
    public void run(String... args) {
        exitCode = start();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int start() {
        io.println(RULE);
        io.println(" EcoTech Solutions - Environmental Management");
        io.println(RULE);

        if (!storageReachable()) {
            return EXIT_FAILURE;
        }

        AuthenticationSession session = sessionFactory.newSession();
        try {
            if (!login(session)) {
                return EXIT_FAILURE;
            }
            mainMenu(session);
            session.logout();
        } catch (EndOfInputException e) {
            log.info("[CONSOLE_EOF] Input closed | authenticated={}", session.isAuthenticated());
            io.println();
            if (!session.isAuthenticated()) {
                return EXIT_FAILURE;
            }
        }
        io.println("Goodbye.");
        return EXIT_OK;
    }

    private boolean storageReachable() {
        try {
            long accounts = accountManager.countAccounts();
            log.info("[CONSOLE_START] Account store reachable | accounts={}", accounts);
            return true;
        } catch (AccountException e) {
            io.println(exceptionHandler.describe(e));
            io.println("Check the database settings (DB_HOST, DB_PORT, DB_NAME, DB_USER, DB_PASSWORD).");
            return false;
        }
    }

    /* ===== LOGIN ===== */

    private boolean login(AuthenticationSession session) {
        io.println();
        io.println("LOGIN");
        while (!session.isLocked()) {
            int attempt = session.getMaxAttempts() - session.getAttemptsRemaining() + 1;
            io.println("Attempt " + attempt + " of " + session.getMaxAttempts());
            String username = io.readLine("Username: ");
            String password = io.readPassword("Password: ");

            try {
                Account account = session.attempt(username, password);
                io.println("Welcome, " + account.getUsername() + " (" + account.getRole() + ")");
                return true;
            } catch (InvalidCredentialsException e) {
                io.println(exceptionHandler.describe(e));
                if (!session.isLocked()) {
                    io.println("Attempts remaining: " + session.getAttemptsRemaining());
                }
            } catch (ValidationException e) {
                io.println(exceptionHandler.describe(e));
            } catch (AccountLockedException e) {
                io.println(exceptionHandler.describe(e));
                return false;
            } catch (AccountException e) {
                io.println(exceptionHandler.describe(e));
                return false;
            }
        }
        io.println(RULE);
        io.println(" ACCESS DENIED: maximum number of login attempts reached");
        io.println(RULE);
        return false;
    }

    /* ===== MENUS ===== */

    private void mainMenu(AuthenticationSession session) {
        while (true) {
            io.println();
            io.println("MAIN MENU");
            io.println("1. Manage users");
            io.println("2. Air quality report");
            io.println("3. Exit");
            String choice = io.readLine("Choose an option: ");
            if ("3".equals(choice)) {
                return;
            }
            try {
                switch (choice) {
                    case "1":
                        usersMenu(session);
                        break;
                    case "2":
                        airQuality();
                        break;
                    default:
                        io.println("Invalid option, choose 1-3.");
                }
            } catch (EndOfInputException e) {
                throw e;
            } catch (RuntimeException e) {
                io.println(exceptionHandler.describe(e));
            }
        }
    }

    private void usersMenu(AuthenticationSession session) {
        while (true) {
            io.println();
            io.println("USER MANAGEMENT");
            io.println("1. Create user");
            io.println("2. Find user");
            io.println("3. List users");
            io.println("4. Update user");
            io.println("5. Delete user");
            io.println("6. Back");
            String choice = io.readLine("Choose an option: ");
            if ("6".equals(choice)) {
                return;
            }
            try {
                switch (choice) {
                    case "1":
                        createUser();
                        break;
                    case "2":
                        findUser();
                        break;
                    case "3":
                        listUsers();
                        break;
                    case "4":
                        updateUser();
                        break;
                    case "5":
                        deleteUser(session);
                        break;
                    default:
                        io.println("Invalid option, choose 1-6.");
                }
            } catch (EndOfInputException e) {
                throw e;
            } catch (RuntimeException e) {
                io.println(exceptionHandler.describe(e));
            }
        }
    }

    /* ===== USER OPERATIONS ===== */

    private void createUser() {
        String username = io.readLine("Username: ");
        String email = io.readLine("Email: ");
        String password = io.readPassword("Password: ");
        String confirmation = io.readPassword("Confirm password: ");
        if (!password.equals(confirmation)) {
            io.println("Passwords do not match.");
            return;
        }
        String roleInput = io.readLine("Role (user/admin) [user]: ");
        Role role = roleInput.isEmpty() ? Role.USER : Role.fromValue(roleInput);
        if (role == null) {
            io.println("Unknown role '" + roleInput + "'. Use user or admin.");
            return;
        }

        Account created = accountManager.create(username, email, password, role);
        io.println("User '" + created.getUsername() + "' created (ID: " + created.getId() + ")");
    }

    private void findUser() {
        Account account = accountManager.findByUsername(io.readLine("Username: "));
        printDetails(account);
    }

    private void listUsers() {
        List<Account> accounts = accountManager.listAll();
        if (accounts.isEmpty()) {
            io.println("No users registered.");
            return;
        }
        io.printf(TABLE_FORMAT, "ID", "USERNAME", "EMAIL", "ROLE");
        for (Account account : accounts) {
            io.printf(TABLE_FORMAT, account.getId(), account.getUsername(), account.getEmail(), account.getRole());
        }
        io.println("Total: " + accounts.size());
    }

    private void updateUser() {
        Long id = readId();
        if (id == null) {
            return;
        }
        Account current = accountManager.findById(id);
        printDetails(current);
        io.println("Leave a field blank to keep its current value.");

        String email = io.readLine("New email [" + current.getEmail() + "]: ");
        String roleInput = io.readLine("New role (user/admin) [" + current.getRole() + "]: ");
        String password = io.readPassword("New password: ");

        Role role = null;
        if (!roleInput.isEmpty()) {
            role = Role.fromValue(roleInput);
            if (role == null) {
                io.println("Unknown role '" + roleInput + "'. Use user or admin.");
                return;
            }
        }
        if (email.isEmpty() && role == null && password.isEmpty()) {
            io.println("No changes.");
            return;
        }

        Account updated = accountManager.update(id, email, role, password);
        io.println("User '" + updated.getUsername() + "' updated.");
    }

    private void deleteUser(AuthenticationSession session) {
        Long id = readId();
        if (id == null) {
            return;
        }
        Account target = accountManager.findById(id);
        long currentId = session.getCurrentAccount()
                .map(Account::getId)
                .orElseThrow(() -> new IllegalStateException("No authenticated account"));

        if (target.getId() != currentId) {
            String answer = io.readLine("Delete user '" + target.getUsername() + "'? (y/n): ");
            if (!answer.toLowerCase(Locale.ROOT).startsWith("y")) {
                io.println("Deletion cancelled.");
                return;
            }
        }
        accountManager.delete(target.getId(), currentId);
        io.println("User '" + target.getUsername() + "' deleted.");
    }

    private Long readId() {
        String input = io.readLine("User ID: ");
        if (!input.matches("\\d{1,18}")) {
            io.println("The ID must be a positive number.");
            return null;
        }
        return Long.valueOf(input);
    }

    private void printDetails(Account account) {
        io.println("ID: " + account.getId());
        io.println("Username: " + account.getUsername());
        io.println("Email: " + account.getEmail());
        io.println("Role: " + account.getRole());
    }

    /* ===== AIR QUALITY ===== */

    private void airQuality() {
        String city = io.readLine("City (blank for default): ");
        io.println("Querying air quality...");
        try {
            AirQualityReport report = airQualityClient.fetch(city);
            airQualityView.render(report).forEach(io::println);
        } catch (AirQualityException e) {
            io.println(exceptionHandler.describe(e));
        }
        io.readLine("Press Enter to continue...");
    }
}
