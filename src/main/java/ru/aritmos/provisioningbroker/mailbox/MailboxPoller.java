package ru.aritmos.provisioningbroker.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.core.JobDeadline;
import ru.aritmos.provisioningbroker.core.SensitiveDataSanitizer;
import ru.aritmos.provisioningbroker.core.Sleeper;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ожидание одноразового кода в почтовом ящике.
 * <p>
 * Каждая попытка: подключиться, найти письма-кандидаты, отбросить полученные раньше
 * {@code sentAfter - clockSkew} и уже использованные, взять самое свежее, извлечь код,
 * захватить письмо в {@link ConsumedMessageRegistry} и пометить его прочитанным.
 * <p>
 * Ошибка подключения/поиска проваливает только текущую попытку.
 * Экземпляр создаётся на задание.
 */
public class MailboxPoller {

    private static final Logger log = LoggerFactory.getLogger(MailboxPoller.class);

    private final MailboxClient client;
    private final MailboxModels.MailboxConnection connection;
    private final RuntimeConfigStore.MailboxConfig config;
    private final OtpExtractor extractor;
    private final ConsumedMessageRegistry consumed;
    private final Sleeper sleeper;
    private final JobDeadline deadline;
    private final String logPrefix;

    public MailboxPoller(MailboxClient client,
                         MailboxModels.MailboxConnection connection,
                         RuntimeConfigStore.MailboxConfig config,
                         ConsumedMessageRegistry consumed,
                         Sleeper sleeper,
                         JobDeadline deadline,
                         String logPrefix) {
        this.client = client;
        this.connection = connection;
        this.config = config == null ? RuntimeConfigStore.MailboxConfig.defaultConfig() : config;
        this.extractor = new OtpExtractor(this.config.codePatterns(), this.config.codeLength());
        this.consumed = consumed == null ? new ConsumedMessageRegistry() : consumed;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.deadline = deadline == null ? JobDeadline.unlimited() : deadline;
        this.logPrefix = logPrefix == null ? "[MAILBOX]" : logPrefix;
    }

    /**
     * Дождаться кода.
     *
     * @param sentAfter   момент запроса кода
     * @param maxAttempts число попыток опроса
     * @param interval    пауза между попытками
     * @return код или пусто, если попытки исчерпаны
     */
    public Optional<String> awaitCode(Instant sentAfter, int maxAttempts, Duration interval) {
        int attempts = Math.max(1, maxAttempts);
        Instant notBefore = sentAfter == null ? null : sentAfter.minusSeconds(config.clockSkewSec());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            deadline.check("ожидание кода");
            Optional<String> code = pollOnce(notBefore, attempt, attempts);
            if (code.isPresent()) {
                log.info("{} код подтверждения получен с попытки {}/{}", logPrefix, attempt, attempts);
                return code;
            }
            if (attempt < attempts) {
                sleeper.sleep(interval);
            }
        }
        log.warn("{} код подтверждения не получен за {} попыток", logPrefix, attempts);
        return Optional.empty();
    }

    private Optional<String> pollOnce(Instant notBefore, int attempt, int attempts) {
        MailboxModels.MailboxQuery query = new MailboxModels.MailboxQuery(
                config.senders(), config.subjectContains(), notBefore, config.maxCandidates());
        try (MailboxClient.MailboxSession session = client.open(connection)) {
            List<MailboxModels.MailboxMessage> candidates = session.fetchCandidates(query);
            for (MailboxModels.MailboxMessage m : candidates) {
                if (m == null || m.key() == null) {
                    continue;
                }
                if (notBefore != null && m.receivedAt() != null && m.receivedAt().isBefore(notBefore)) {
                    continue;
                }
                if (consumed.isConsumed(m.key())) {
                    continue;
                }
                Optional<String> code = extractor.extract(m);
                if (code.isEmpty()) {
                    log.debug("{} письмо {} не содержит кода", logPrefix, m.key());
                    continue;
                }
                if (!consumed.claim(m.key(), config.consumedTtlSec())) {
                    // Письмо забрал конкурентный опрос: для этого задания код ещё не пришёл.
                    log.debug("{} письмо {} уже использовано другим заданием", logPrefix, m.key());
                    return Optional.empty();
                }
                markSeen(session, m.key());
                return code;
            }
            log.debug("{} попытка {}/{}: подходящих писем нет", logPrefix, attempt, attempts);
            return Optional.empty();
        } catch (MailboxException e) {
            log.warn("{} попытка {}/{} опроса почты неуспешна: {}", logPrefix, attempt, attempts,
                    SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            return Optional.empty();
        }
    }

    private void markSeen(MailboxClient.MailboxSession session, String key) {
        try {
            session.markSeen(key);
        } catch (MailboxException e) {
            // Письмо уже захвачено в реестре процесса, повторно оно не будет использовано.
            log.warn("{} не удалось пометить письмо прочитанным: {}", logPrefix, e.getMessage());
        }
    }
}
