package de.jwiegmann.meetinglog.boundary.dto.commit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fortschritt nach jedem verarbeiteten Eintrag, egal ob der Append geklappt hat.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitProgressEvent {
    private int position;
    private int total;
    private double fraction;
    private boolean appended;
    private boolean attachmentFailed;
}
