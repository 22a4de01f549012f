package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.exception.RelayException;
import de.jwiegmann.meetinglog.entity.Attachment;
import de.jwiegmann.meetinglog.entity.CartItem;
import de.jwiegmann.meetinglog.entity.MeetingRecord;
import de.jwiegmann.meetinglog.entity.SessionContext;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Bereitet einen Warenkorb-Eintrag für den Append vor: Anhang über das Relay hochladen
 * und den finalen Record bauen. Schreibt selbst nichts in den Store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommitItemProcessor {

    private static final DateTimeFormatter FILENAME_PREFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final RelayUploadClient relayUploadClient;
    private final MeetingLogProperties properties;

    /**
     * Ein fehlgeschlagener Upload bricht nicht ab: der Record bekommt eine leere attachmentUrl
     * und der Fehler wird im Ergebnis mitgeliefert.
     *
     * @param session     Die Session mit Abteilung/Gruppe
     * @param item        Der Eintrag aus dem Warenkorb
     * @param meetingDate Das gewählte Sitzungsdatum
     * @param submittedAt Zeitstempel für Record und Dateiname
     * @return Record plus evtl. Relay-Fehler
     */
    public PreparedItem prepare(SessionContext session, CartItem item, LocalDate meetingDate, LocalDateTime submittedAt) {

        String attachmentUrl = "";
        RelayException attachmentError = null;

        if (item.hasAttachment()) {
            Attachment attachment = item.getAttachment();
            try {
                attachmentUrl = relayUploadClient.upload(
                        attachment.getContent(),
                        uploadFilename(attachment.getFilename(), submittedAt),
                        attachment.getMimeType());
            } catch (RelayException e) {
                log.warn("Attachment '{}' of session {} not uploaded ({}): {}",
                        attachment.getFilename(), session.getSessionId(), e.getKind(), e.getMessage());
                attachmentError = e;
            }
        }

        MeetingRecord record = MeetingRecord.builder()
                .id(UUID.randomUUID().toString())
                .submittedAt(submittedAt)
                .meetingDate(meetingDate.toString())
                .department(session.getDepartment())
                .group(session.getGroup())
                .content(item.getContent())
                .attachmentUrl(attachmentUrl)
                .build();

        return new PreparedItem(record, attachmentError);
    }

    String uploadFilename(String filename, LocalDateTime submittedAt) {
        if (!properties.getRelay().isTimestampFilenames()) {
            return filename;
        }
        return submittedAt.format(FILENAME_PREFIX) + "_" + filename;
    }

    @Value
    public static class PreparedItem {
        MeetingRecord record;
        RelayException attachmentError; // null = kein Fehler

        public boolean attachmentFailed() {
            return attachmentError != null;
        }
    }
}
