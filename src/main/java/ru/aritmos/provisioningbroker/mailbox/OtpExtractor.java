package ru.aritmos.provisioningbroker.mailbox;

import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Извлечение одноразового кода из письма.
 * <p>
 * Шаблоны применяются по порядку, от наиболее специфичного к наиболее общему;
 * побеждает первое совпадение нужной длины. Если в шаблоне есть группа, берётся группа 1.
 */
public class OtpExtractor {

    private final List<Pattern> patterns;
    private final int codeLength;

    public OtpExtractor(List<String> patterns, int codeLength) {
        this.patterns = patterns == null ? List.of() : patterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.codeLength = codeLength;
    }

    /**
     * Найти код в тексте.
     */
    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String candidate = m.groupCount() >= 1 ? m.group(1) : m.group();
                if (candidate != null && candidate.length() == codeLength && candidate.chars().allMatch(Character::isDigit)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Найти код в письме: сначала тело, затем тема.
     */
    public Optional<String> extract(MailboxModels.MailboxMessage message) {
        if (message == null) {
            return Optional.empty();
        }
        Optional<String> fromBody = extract(message.body());
        return fromBody.isPresent() ? fromBody : extract(message.subject());
    }

    /**
     * Текст MIME-части: text/plain предпочтительнее, HTML очищается от тегов.
     * Содержимое с неизвестной кодировкой декодируется как UTF-8, при ошибке как ISO-8859-1.
     */
    public static String extractText(Part part) throws MessagingException, IOException {
        if (part == null) {
            return "";
        }
        if (part.isMimeType("text/plain")) {
            return contentAsString(part.getContent());
        }
        if (part.isMimeType("text/html")) {
            return stripHtml(contentAsString(part.getContent()));
        }
        if (part.isMimeType("multipart/*")) {
            Multipart mp = (Multipart) part.getContent();
            String html = null;
            for (int i = 0; i < mp.getCount(); i++) {
                BodyPart bp = mp.getBodyPart(i);
                if (bp.isMimeType("text/plain")) {
                    return contentAsString(bp.getContent());
                }
                if (html == null && (bp.isMimeType("text/html") || bp.isMimeType("multipart/*"))) {
                    html = extractText(bp);
                }
            }
            return html == null ? "" : html;
        }
        Object content = part.getContent();
        return content instanceof InputStream ? contentAsString(content) : "";
    }

    static String stripHtml(String html) {
        if (html == null) {
            return "";
        }
        return html.replaceAll("(?is)<(script|style)[^>]*>.*?</\\1>", " ")
                .replaceAll("<[^>]+>", " ")
                .replace("&nbsp;", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static String contentAsString(Object content) throws IOException {
        if (content == null) {
            return "";
        }
        if (content instanceof String) {
            return (String) content;
        }
        if (content instanceof InputStream) {
            try (InputStream is = (InputStream) content) {
                return decode(is.readAllBytes());
            }
        }
        return String.valueOf(content);
    }

    static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
