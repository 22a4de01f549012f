package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.entity.DirectoryEntry;
import de.jwiegmann.meetinglog.entity.MeetingRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Übersetzt zwischen Store-Zeilen und Domain-Objekten.
 * Zeilen können kürzer sein als das Layout (leere Zellen am Ende werden vom Store abgeschnitten).
 */
@Component
public class RowMapper {

    public static final DateTimeFormatter SUBMITTED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // [department, group, password]
    public DirectoryEntry toDirectoryEntry(List<String> row) {
        return DirectoryEntry.builder()
                .department(cell(row, 0))
                .group(cell(row, 1))
                .secret(cell(row, 2))
                .build();
    }

    // [id, submittedAt, meetingDate, department, group, content, attachmentURL]
    public MeetingRecord toRecord(List<String> row) {
        return MeetingRecord.builder()
                .id(cell(row, 0))
                .submittedAt(parseSubmittedAt(cell(row, 1)))
                .meetingDate(cell(row, 2))
                .department(cell(row, 3))
                .group(cell(row, 4))
                .content(cell(row, 5))
                .attachmentUrl(cell(row, 6))
                .build();
    }

    public List<String> toRow(MeetingRecord record) {
        return List.of(
                record.getId(),
                record.getSubmittedAt().format(SUBMITTED_AT_FORMAT),
                record.getMeetingDate(),
                record.getDepartment(),
                record.getGroup(),
                record.getContent(),
                record.getAttachmentUrl() == null ? "" : record.getAttachmentUrl()
        );
    }

    private static String cell(List<String> row, int index) {
        if (index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index);
    }

    private static LocalDateTime parseSubmittedAt(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, SUBMITTED_AT_FORMAT);
        } catch (DateTimeParseException e) {
            return null; // von Hand gepflegte Zeilen
        }
    }
}
