package de.jwiegmann.meetinglog.entity;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Ein festgeschriebener Bericht im Record-Log. Wird nach dem Append nie wieder verändert.
 */
@Value
@Builder
public class MeetingRecord {

    String id;
    LocalDateTime submittedAt;
    String meetingDate;       // ISO yyyy-MM-dd, so wie im Store abgelegt
    String department;
    String group;
    String content;

    @Builder.Default
    String attachmentUrl = ""; // leer, wenn kein Anhang

    public boolean hasAttachment() {
        return attachmentUrl != null && !attachmentUrl.isEmpty();
    }
}
