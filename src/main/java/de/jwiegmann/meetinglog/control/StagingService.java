package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.exception.ValidationException;
import de.jwiegmann.meetinglog.entity.Attachment;
import de.jwiegmann.meetinglog.entity.CartItem;
import de.jwiegmann.meetinglog.entity.SessionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Warenkorb einer Session: Einträge vormerken, verwerfen, anzeigen.
 * Nichts davon berührt den Record Store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagingService {

    private final MeetingLogProperties properties;

    /**
     * Hängt einen Eintrag an das Ende des Warenkorbs.
     *
     * @param attachment optional, null = kein Anhang
     * @throws ValidationException bei leerem Inhalt oder unzulässigem Anhang
     */
    public void stage(SessionContext session, String content, Attachment attachment) {

        if (content == null || content.isEmpty()) {
            throw new ValidationException("EMPTY_CONTENT", "content must not be empty");
        }
        if (attachment != null) {
            validateAttachment(attachment);
        }

        session.getCart().append(new CartItem(content, attachment));
        log.info("Session {} staged item #{}{}", session.getSessionId(), session.getCart().size(),
                attachment != null ? " with attachment '" + attachment.getFilename() + "'" : "");
    }

    public void discardAll(SessionContext session) {
        session.getCart().clear();
    }

    public List<CartItem> items(SessionContext session) {
        return session.getCart().items();
    }

    private void validateAttachment(Attachment attachment) {
        MeetingLogProperties.Attachments rules = properties.getAttachments();

        String extension = extensionOf(attachment.getFilename());
        boolean allowed = rules.getAllowedExtensions().stream()
                .anyMatch(candidate -> candidate.equalsIgnoreCase(extension));
        if (!allowed) {
            throw new ValidationException("ATTACHMENT_TYPE_NOT_ALLOWED",
                    "attachment type not allowed (allowed: " + String.join(", ", rules.getAllowedExtensions()) + ")");
        }

        if (attachment.size() > rules.getMaxSize().toBytes()) {
            throw new ValidationException("ATTACHMENT_TOO_LARGE",
                    "attachment exceeds " + rules.getMaxSize());
        }
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
