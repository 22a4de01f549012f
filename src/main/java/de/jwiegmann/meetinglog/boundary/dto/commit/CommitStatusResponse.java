package de.jwiegmann.meetinglog.boundary.dto.commit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Zwischenstand eines Commits, abfragbar während der Lauf noch arbeitet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommitStatusResponse {
    private String sessionId;
    private boolean running;
    private CommitProgressEvent lastProgress;   // null solange noch kein Eintrag fertig ist
}
