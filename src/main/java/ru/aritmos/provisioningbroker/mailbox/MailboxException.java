package ru.aritmos.provisioningbroker.mailbox;

/**
 * Ошибка подключения/поиска в почтовом ящике. Проваливает только текущую попытку опроса.
 */
public class MailboxException extends RuntimeException {

    public MailboxException(String message, Throwable cause) {
        super(message, cause);
    }

    public MailboxException(String message) {
        super(message);
    }
}
