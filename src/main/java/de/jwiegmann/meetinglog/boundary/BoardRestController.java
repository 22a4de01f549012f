package de.jwiegmann.meetinglog.boundary;

import de.jwiegmann.meetinglog.boundary.dto.board.BoardResponse;
import de.jwiegmann.meetinglog.control.BoardService;
import de.jwiegmann.meetinglog.control.DirectoryService;
import de.jwiegmann.meetinglog.control.SnapshotCache;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/meeting-log-api/v1")
public class BoardRestController {

    private final BoardService boardService;
    private final DirectoryService directoryService;
    private final SnapshotCache snapshotCache;

    public BoardRestController(BoardService boardService, DirectoryService directoryService, SnapshotCache snapshotCache) {
        this.boardService = boardService;
        this.directoryService = directoryService;
        this.snapshotCache = snapshotCache;
    }

    /**
     * GET /meeting-log-api/v1/records/dates — Sitzungsdaten, neuestes zuerst
     */
    @GetMapping("/records/dates")
    public ResponseEntity<List<LocalDate>> getMeetingDates() {
        return ResponseEntity.ok(boardService.meetingDates());
    }

    /**
     * GET /meeting-log-api/v1/records?meetingDate=2024-03-01
     */
    @GetMapping("/records")
    public ResponseEntity<BoardResponse> getBoard(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate meetingDate) {
        return ResponseEntity.ok(boardService.board(meetingDate));
    }

    /**
     * POST /meeting-log-api/v1/records/refresh — manuelles Neuladen
     */
    @PostMapping("/records/refresh")
    public ResponseEntity<Void> refresh() {
        snapshotCache.invalidate();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/directory/departments")
    public ResponseEntity<List<String>> getDepartments() {
        return ResponseEntity.ok(directoryService.departments());
    }

    @GetMapping("/directory/departments/{department}/groups")
    public ResponseEntity<List<String>> getGroups(@PathVariable String department) {
        return ResponseEntity.ok(directoryService.groups(department));
    }
}
