package ru.aritmos.provisioningbroker.mailbox;

import java.time.Instant;
import java.util.List;

/**
 * Модели работы с почтовым ящиком одноразовых кодов.
 */
public final class MailboxModels {

    private MailboxModels() {
    }

    /**
     * Параметры подключения к ящику (включая секрет; не логировать целиком).
     */
    public record MailboxConnection(String host,
                                    int port,
                                    String folder,
                                    String username,
                                    String password,
                                    int connectTimeoutMs,
                                    int readTimeoutMs) {

        @Override
        public String toString() {
            return "MailboxConnection{" + username + "@" + host + ":" + port + "/" + folder + "}";
        }
    }

    /**
     * Критерии поиска писем с кодом.
     *
     * @param senders         допустимые отправители
     * @param subjectContains подстрока темы (null = без фильтра)
     * @param receivedAfter   нижняя граница времени получения (с учётом допуска на расхождение часов)
     * @param maxCandidates   сколько самых свежих писем разбирать
     */
    public record MailboxQuery(List<String> senders, String subjectContains, Instant receivedAfter, int maxCandidates) {
    }

    /**
     * Письмо, уже отделённое от IMAP-папки.
     *
     * @param key        устойчивый ключ письма (Message-ID или UID)
     * @param from       адрес отправителя
     * @param subject    тема
     * @param receivedAt время получения сервером
     * @param body       текст письма (text/plain либо очищенный HTML)
     */
    public record MailboxMessage(String key, String from, String subject, Instant receivedAt, String body) {
    }
}
