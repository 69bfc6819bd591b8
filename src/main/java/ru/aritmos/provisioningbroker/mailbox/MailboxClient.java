package ru.aritmos.provisioningbroker.mailbox;

import java.util.List;

/**
 * Доступ к почтовому ящику с одноразовыми кодами.
 * <p>
 * Сессия открывается на одну попытку опроса и закрывается сразу после неё.
 */
public interface MailboxClient {

    /**
     * Открыть сессию.
     *
     * @throws MailboxException если подключиться не удалось
     */
    MailboxSession open(MailboxModels.MailboxConnection connection);

    interface MailboxSession extends AutoCloseable {

        /**
         * Найти письма-кандидаты: сначала непрочитанные, затем (если их нет) недавние.
         * Результат упорядочен от новых к старым.
         */
        List<MailboxModels.MailboxMessage> fetchCandidates(MailboxModels.MailboxQuery query);

        /**
         * Пометить письмо прочитанным на сервере.
         */
        void markSeen(String key);

        @Override
        void close();
    }
}
