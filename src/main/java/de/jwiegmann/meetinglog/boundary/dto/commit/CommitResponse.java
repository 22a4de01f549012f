package de.jwiegmann.meetinglog.boundary.dto.commit;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.meetinglog.boundary.dto.error.ApiError;
import de.jwiegmann.meetinglog.boundary.dto.status.CommitOutcome;
import de.jwiegmann.meetinglog.boundary.dto.status.StopReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response-DTO für einen Commit: Gesamtergebnis plus Ergebnis und Fortschritt pro Eintrag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommitResponse {
    private String sessionId;
    private CommitOutcome outcome;
    private int total;
    private int processed;
    private int appended;

    private StopReason stopReason;     // nur bei FATAL_STOP
    private Integer failedPosition;    // 1-basiert, nur bei FATAL_STOP
    private ApiError error;
    private String duplicationWarning;

    @Builder.Default
    private List<CommitItemResult> items = new ArrayList<>();

    @Builder.Default
    private List<CommitProgressEvent> progress = new ArrayList<>();
}
