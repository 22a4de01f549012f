package de.jwiegmann.meetinglog.boundary.dto.commit;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitRequest {

    @NotNull
    private LocalDate meetingDate;
}
