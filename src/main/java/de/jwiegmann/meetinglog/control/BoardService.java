package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.boundary.dto.board.BoardResponse;
import de.jwiegmann.meetinglog.boundary.dto.board.DepartmentRecords;
import de.jwiegmann.meetinglog.boundary.dto.board.RecordView;
import de.jwiegmann.meetinglog.entity.MeetingRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lesepfad für die Übersicht der Sitzungsberichte. Liest ausschließlich über den SnapshotCache.
 */
@Service
@RequiredArgsConstructor
public class BoardService {

    private static final String DRIVE_HOST = "drive.google.com";

    private final SnapshotCache snapshotCache;

    /**
     * Alle Sitzungsdaten, neuestes zuerst. Nicht parsebare Datumswerte werden ignoriert.
     */
    public List<LocalDate> meetingDates() {
        return snapshotCache.get().getRecords().stream()
                .map(record -> parseDate(record.getMeetingDate()))
                .flatMap(Optional::stream)
                .distinct()
                .sorted(Comparator.reverseOrder())
                .toList();
    }

    /**
     * Berichte einer Sitzung, gruppiert nach Abteilung in der Reihenfolge des ersten Auftretens.
     */
    public BoardResponse board(LocalDate meetingDate) {

        Map<String, List<RecordView>> byDepartment = new LinkedHashMap<>();
        int total = 0;

        for (MeetingRecord record : snapshotCache.get().getRecords()) {
            if (!parseDate(record.getMeetingDate()).map(meetingDate::equals).orElse(false)) {
                continue;
            }
            byDepartment.computeIfAbsent(record.getDepartment(), k -> new ArrayList<>()).add(toView(record));
            total++;
        }

        List<DepartmentRecords> departments = byDepartment.entrySet().stream()
                .map(e -> DepartmentRecords.builder().department(e.getKey()).records(e.getValue()).build())
                .toList();

        return BoardResponse.builder()
                .meetingDate(meetingDate)
                .total(total)
                .departments(departments)
                .build();
    }

    /**
     * Vorschaubild für Drive-Links: id aus "id=..." oder dem vorletzten Pfadsegment.
     *
     * @return Thumbnail-URL oder null, wenn der Link keine Drive-URL ist
     */
    static String previewUrl(String attachmentUrl) {
        if (attachmentUrl == null || !attachmentUrl.contains(DRIVE_HOST)) {
            return null;
        }

        String fileId;
        int idParam = attachmentUrl.lastIndexOf("id=");
        if (idParam >= 0) {
            fileId = attachmentUrl.substring(idParam + 3);
            int end = fileId.indexOf('&');
            if (end >= 0) {
                fileId = fileId.substring(0, end);
            }
        } else {
            String[] segments = attachmentUrl.split("/");
            if (segments.length < 2) {
                return null;
            }
            fileId = segments[segments.length - 2];
        }

        if (fileId.isEmpty()) {
            return null;
        }
        return "https://" + DRIVE_HOST + "/thumbnail?id=" + fileId + "&sz=w800";
    }

    private static RecordView toView(MeetingRecord record) {
        return RecordView.builder()
                .id(record.getId())
                .submittedAt(record.getSubmittedAt())
                .group(record.getGroup())
                .content(record.getContent())
                .attachmentUrl(record.hasAttachment() ? record.getAttachmentUrl() : null)
                .previewUrl(previewUrl(record.getAttachmentUrl()))
                .build();
    }

    private static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        // "2024-03-01 00:00:00" aus Tabellen-Exporten
        String datePart = trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed;
        try {
            return Optional.of(LocalDate.parse(datePart));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
