package de.jwiegmann.meetinglog.boundary.dto.commit;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.meetinglog.boundary.dto.error.ApiError;
import de.jwiegmann.meetinglog.boundary.dto.status.CommitItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ergebnis für einen einzelnen Eintrag innerhalb eines Commit-Laufs.
 * attachmentError ist auch bei APPENDED gesetzt, wenn nur der Anhang fehlgeschlagen ist.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommitItemResult {
    private int position;
    private CommitItemStatus status;
    private String recordId;
    private String attachmentUrl;
    private ApiError attachmentError;
    private ApiError error;
}
