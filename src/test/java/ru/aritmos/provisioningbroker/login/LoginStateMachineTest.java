package ru.aritmos.provisioningbroker.login;

import org.junit.jupiter.api.Test;
import ru.aritmos.provisioningbroker.browser.FakeConsole;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.core.JobDeadline;
import ru.aritmos.provisioningbroker.core.ProvisioningModels;
import ru.aritmos.provisioningbroker.core.TestConfigs;
import ru.aritmos.provisioningbroker.mailbox.ConsumedMessageRegistry;
import ru.aritmos.provisioningbroker.mailbox.FakeMailboxClient;
import ru.aritmos.provisioningbroker.mailbox.MailboxModels;
import ru.aritmos.provisioningbroker.mailbox.MailboxPoller;
import ru.aritmos.provisioningbroker.retry.RetryOrchestrator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoginStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String TENANT = "acme";

    private final RuntimeConfigStore.RuntimeConfig config = TestConfigs.runtime();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<ProvisioningModels.JobStatus> statuses = new ArrayList<>();

    private static MailboxModels.MailboxMessage otp(String key, String code) {
        return new MailboxModels.MailboxMessage(key, "noreply@gohighlevel.com", "Login security code",
                NOW.plusSeconds(3), "Your login security code: " + code);
    }

    private LoginStateMachine machine(FakeConsole console, FakeMailboxClient mailbox, String identity, String secret) {
        RetryOrchestrator retry = new RetryOrchestrator(Duration.ofMillis(1), Duration.ofMillis(2), d -> { },
                JobDeadline.unlimited(), "[TEST]");
        MailboxPoller poller = new MailboxPoller(mailbox,
                new MailboxModels.MailboxConnection("imap.example.org", 993, "INBOX", "otp@example.org", "pw", 1000, 1000),
                config.mailbox(), new ConsumedMessageRegistry(clock), d -> { }, JobDeadline.unlimited(), "[TEST]");
        return new LoginStateMachine(console, retry, poller, config, identity, secret, clock,
                JobDeadline.unlimited(), "job-1", statuses::add, "[TEST]");
    }

    private static FakeConsole openConsole() {
        FakeConsole console = new FakeConsole("ops@example.org", "s3cret", TENANT);
        console.navigate(FakeConsole.integrationsUrl(TENANT), Duration.ofSeconds(1));
        return console;
    }

    @Test
    void logsInWithCodeArrivingOnThirdPoll() {
        FakeConsole console = openConsole();
        FakeMailboxClient mailbox = FakeMailboxClient.codeFrom(3, otp("m-1", "123456"));
        LoginStateMachine machine = machine(console, mailbox, "ops@example.org", "s3cret");

        LoginOutcome outcome = machine.run();

        assertTrue(outcome.isAuthenticated(), "TEST_EXPECTED: вход выполнен, причина: " + outcome.reason());
        assertEquals(2, outcome.transitions());
        assertEquals(1, outcome.otpAttempts());
        assertEquals(3, mailbox.opens());
        assertEquals(1, console.codesSent());
        assertEquals(List.of(ProvisioningModels.JobStatus.AUTHENTICATING, ProvisioningModels.JobStatus.AWAITING_MFA), statuses);
        assertTrue(machine.lastChallenge().isConsumed(), "TEST_EXPECTED: код использован ровно один раз");
        assertEquals(NOW, machine.lastChallenge().sentAt());
        assertTrue(console.actions().contains("fillPerCharacter " + FakeConsole.MFA_DIGITS),
                "TEST_EXPECTED: код раскладывается по полям-цифрам");
    }

    @Test
    void otpTimeoutAfterAllPolls() {
        FakeConsole console = openConsole();
        FakeMailboxClient mailbox = FakeMailboxClient.empty();
        LoginStateMachine machine = machine(console, mailbox, "ops@example.org", "s3cret");

        LoginOutcome outcome = machine.run();

        assertEquals(LoginState.FAILED, outcome.state());
        assertEquals(ProvisioningModels.ErrorCode.OTP_TIMEOUT, outcome.errorCode());
        assertEquals(30, mailbox.opens(), "TEST_EXPECTED: ровно pollAttempts опросов");
        assertTrue(machine.lastChallenge().isExpired());
    }

    @Test
    void repeatedLoginFormMeansRejectedCredentials() {
        FakeConsole console = openConsole().rejectCredentials();
        LoginStateMachine machine = machine(console, FakeMailboxClient.empty(), "ops@example.org", "s3cret");

        LoginOutcome outcome = machine.run();

        assertEquals(ProvisioningModels.ErrorCode.LOGIN_REJECTED, outcome.errorCode());
        long submits = console.actions().stream().filter(a -> a.equals("click " + FakeConsole.SIGN_IN)).count();
        assertEquals(2, submits, "TEST_EXPECTED: не больше maxLoginAttempts отправок формы");
    }

    @Test
    void repeatedMfaChallengeMeansRejectedCode() {
        FakeConsole console = openConsole().expectedCode("999999");
        FakeMailboxClient mailbox = new FakeMailboxClient(n -> List.of(otp("m-" + n, "123456")));
        LoginStateMachine machine = machine(console, mailbox, "ops@example.org", "s3cret");

        LoginOutcome outcome = machine.run();

        assertEquals(ProvisioningModels.ErrorCode.OTP_REJECTED, outcome.errorCode());
        assertEquals(3, console.codesSent(), "TEST_EXPECTED: не больше maxMfaAttempts запросов кода");
        assertEquals(3, outcome.otpAttempts());
    }

    @Test
    void missingCredentialsFailWithoutTyping() {
        FakeConsole console = openConsole();
        LoginOutcome outcome = machine(console, FakeMailboxClient.empty(), "ops@example.org", null).run();

        assertEquals(ProvisioningModels.ErrorCode.LOGIN_REJECTED, outcome.errorCode());
        assertTrue(console.actions().isEmpty());
    }

    @Test
    void closedPageIsFatal() {
        FakeConsole console = openConsole();
        console.crash();
        LoginOutcome outcome = machine(console, FakeMailboxClient.empty(), "ops@example.org", "s3cret").run();
        assertEquals(ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT, outcome.errorCode());
    }

    @Test
    void unrecognizedPageAfterUnknownPageLimit() {
        FakeConsole console = new FakeConsole("ops@example.org", "s3cret", TENANT);
        LoginOutcome outcome = machine(console, FakeMailboxClient.empty(), "ops@example.org", "s3cret").run();

        assertEquals(ProvisioningModels.ErrorCode.UNRECOGNIZED_PAGE, outcome.errorCode());
        assertEquals(config.login().maxUnknownProbes(), console.settles());
    }

    @Test
    void challengeCodeIsConsumedOnce() {
        OtpChallenge challenge = new OtpChallenge("job-1", NOW);
        challenge.received("123456");
        assertEquals("123456", challenge.consume());
        assertEquals(null, challenge.consume(), "TEST_EXPECTED: повторное использование кода невозможно");
        assertTrue(!challenge.toString().contains("123456"), "TEST_EXPECTED: код не попадает в toString");
    }
}
