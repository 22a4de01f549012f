package de.jwiegmann.meetinglog.boundary.dto.board;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Alle Berichte einer Sitzung, gruppiert nach Abteilung.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardResponse {
    private LocalDate meetingDate;
    private int total;
    private List<DepartmentRecords> departments;
}
