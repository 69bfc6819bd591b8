package ru.aritmos.provisioningbroker.mailbox;

import jakarta.inject.Singleton;
import jakarta.mail.Address;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.FromStringTerm;
import jakarta.mail.search.OrTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import jakarta.mail.search.SubjectTerm;
import org.eclipse.angus.mail.imap.IMAPMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.core.SensitiveDataSanitizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * IMAPS-клиент почтового ящика (Jakarta Mail, реализация Eclipse Angus).
 * <p>
 * Только чтение и поиск; единственное изменение на сервере: флаг {@code \Seen} у использованного письма.
 * Тело читается в режиме peek, чтобы простое чтение не помечало письмо прочитанным.
 */
@Singleton
public class ImapMailboxClient implements MailboxClient {

    private static final Logger log = LoggerFactory.getLogger(ImapMailboxClient.class);

    private static final String PROTOCOL = "imaps";

    @Override
    public MailboxSession open(MailboxModels.MailboxConnection connection) {
        if (connection == null || connection.host() == null || connection.username() == null) {
            throw new MailboxException("Не заданы параметры подключения к почтовому ящику");
        }
        Properties props = new Properties();
        props.put("mail.store.protocol", PROTOCOL);
        props.put("mail.imaps.host", connection.host());
        props.put("mail.imaps.port", String.valueOf(connection.port()));
        props.put("mail.imaps.ssl.enable", "true");
        props.put("mail.imaps.connectiontimeout", String.valueOf(connection.connectTimeoutMs()));
        props.put("mail.imaps.timeout", String.valueOf(connection.readTimeoutMs()));

        Store store = null;
        try {
            Session session = Session.getInstance(props);
            store = session.getStore(PROTOCOL);
            store.connect(connection.host(), connection.port(), connection.username(), connection.password());
            Folder folder = store.getFolder(connection.folder());
            folder.open(Folder.READ_WRITE);
            return new ImapSession(store, folder);
        } catch (MessagingException e) {
            closeQuietly(store);
            throw new MailboxException("Не удалось подключиться к почтовому ящику " + connection + ": "
                    + SensitiveDataSanitizer.sanitizeText(e.getMessage()), e);
        }
    }

    private static void closeQuietly(Store store) {
        if (store == null) {
            return;
        }
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("Ошибка закрытия IMAP store: {}", e.getMessage());
        }
    }

    static final class ImapSession implements MailboxSession {

        private final Store store;
        private final Folder folder;
        private final Map<String, Message> byKey = new HashMap<>();

        ImapSession(Store store, Folder folder) {
            this.store = store;
            this.folder = folder;
        }

        @Override
        public List<MailboxModels.MailboxMessage> fetchCandidates(MailboxModels.MailboxQuery query) {
            try {
                SearchTerm base = baseTerm(query);
                Message[] found = folder.search(new AndTerm(base, new FlagTerm(new Flags(Flags.Flag.SEEN), false)));
                if (found.length == 0 && query.receivedAfter() != null) {
                    // Письмо могло быть прочитано предыдущей попыткой: ищем среди недавних.
                    found = folder.search(new AndTerm(base,
                            new ReceivedDateTerm(ComparisonTerm.GE, Date.from(query.receivedAfter()))));
                }
                List<Message> sorted = new ArrayList<>(List.of(found));
                sorted.sort(Comparator.comparing(ImapSession::received, Comparator.nullsLast(Comparator.reverseOrder())));

                List<MailboxModels.MailboxMessage> out = new ArrayList<>();
                for (Message m : sorted.subList(0, Math.min(sorted.size(), Math.max(1, query.maxCandidates())))) {
                    out.add(detach(m));
                }
                return out;
            } catch (Exception e) {
                throw new MailboxException("Ошибка поиска писем: " + SensitiveDataSanitizer.sanitizeText(e.getMessage()), e);
            }
        }

        @Override
        public void markSeen(String key) {
            Message m = byKey.get(key);
            if (m == null) {
                throw new MailboxException("Письмо " + key + " не найдено в текущей сессии");
            }
            try {
                m.setFlag(Flags.Flag.SEEN, true);
            } catch (MessagingException e) {
                throw new MailboxException("Не удалось пометить письмо прочитанным: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                if (folder.isOpen()) {
                    folder.close(false);
                }
            } catch (MessagingException e) {
                log.debug("Ошибка закрытия IMAP-папки: {}", e.getMessage());
            }
            closeQuietly(store);
        }

        private SearchTerm baseTerm(MailboxModels.MailboxQuery query) {
            List<String> senders = query.senders() == null ? List.of() : query.senders();
            SearchTerm senderTerm;
            if (senders.isEmpty()) {
                senderTerm = null;
            } else if (senders.size() == 1) {
                senderTerm = new FromStringTerm(senders.get(0));
            } else {
                senderTerm = new OrTerm(senders.stream().map(FromStringTerm::new).toArray(SearchTerm[]::new));
            }
            SearchTerm subjectTerm = query.subjectContains() == null ? null : new SubjectTerm(query.subjectContains());
            if (senderTerm != null && subjectTerm != null) {
                return new AndTerm(senderTerm, subjectTerm);
            }
            if (senderTerm != null) {
                return senderTerm;
            }
            if (subjectTerm != null) {
                return subjectTerm;
            }
            throw new MailboxException("Не задан ни фильтр отправителей, ни фильтр темы");
        }

        private MailboxModels.MailboxMessage detach(Message m) throws Exception {
            if (m instanceof IMAPMessage) {
                ((IMAPMessage) m).setPeek(true);
            }
            String key = key(m);
            byKey.put(key, m);
            Date received = received(m);
            return new MailboxModels.MailboxMessage(
                    key,
                    from(m.getFrom()),
                    m.getSubject(),
                    received == null ? null : received.toInstant(),
                    OtpExtractor.extractText(m));
        }

        private String key(Message m) throws MessagingException {
            String[] ids = m.getHeader("Message-ID");
            if (ids != null && ids.length > 0 && ids[0] != null && !ids[0].isBlank()) {
                return ids[0].trim();
            }
            if (folder instanceof UIDFolder) {
                return "uid:" + ((UIDFolder) folder).getUIDValidity() + ":" + ((UIDFolder) folder).getUID(m);
            }
            return "msg:" + m.getMessageNumber() + ":" + received(m);
        }

        private static Date received(Message m) {
            try {
                Date d = m.getReceivedDate();
                return d != null ? d : m.getSentDate();
            } catch (MessagingException e) {
                return null;
            }
        }

        private static String from(Address[] addresses) {
            if (addresses == null || addresses.length == 0) {
                return null;
            }
            Address a = addresses[0];
            return a instanceof InternetAddress ? ((InternetAddress) a).getAddress() : a.toString();
        }
    }
}
