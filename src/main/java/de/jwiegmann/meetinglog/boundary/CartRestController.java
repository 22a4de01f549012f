package de.jwiegmann.meetinglog.boundary;

import de.jwiegmann.meetinglog.boundary.dto.cart.CartItemResponse;
import de.jwiegmann.meetinglog.boundary.dto.cart.CartResponse;
import de.jwiegmann.meetinglog.boundary.dto.commit.CommitRequest;
import de.jwiegmann.meetinglog.boundary.dto.commit.CommitResponse;
import de.jwiegmann.meetinglog.boundary.dto.commit.CommitStatusResponse;
import de.jwiegmann.meetinglog.control.BatchCommitPipeline;
import de.jwiegmann.meetinglog.control.SessionManager;
import de.jwiegmann.meetinglog.control.StagingService;
import de.jwiegmann.meetinglog.control.exception.ValidationException;
import de.jwiegmann.meetinglog.entity.Attachment;
import de.jwiegmann.meetinglog.entity.CartItem;
import de.jwiegmann.meetinglog.entity.SessionContext;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/meeting-log-api/v1/sessions/{sessionId}")
public class CartRestController {

    private final SessionManager sessionManager;
    private final StagingService stagingService;
    private final BatchCommitPipeline commitPipeline;

    public CartRestController(SessionManager sessionManager,
                              StagingService stagingService,
                              BatchCommitPipeline commitPipeline) {
        this.sessionManager = sessionManager;
        this.stagingService = stagingService;
        this.commitPipeline = commitPipeline;
    }

    /**
     * GET /meeting-log-api/v1/sessions/{sessionId}/cart
     */
    @GetMapping("/cart")
    public ResponseEntity<CartResponse> getCart(@PathVariable String sessionId) {
        return ResponseEntity.ok(toResponse(sessionManager.require(sessionId)));
    }

    /**
     * POST /meeting-log-api/v1/sessions/{sessionId}/cart — Eintrag vormerken (multipart: content, file)
     */
    @PostMapping(value = "/cart", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CartResponse> stage(@PathVariable String sessionId,
                                              @RequestParam("content") String content,
                                              @RequestPart(value = "file", required = false) MultipartFile file) {

        SessionContext session = sessionManager.require(sessionId);
        stagingService.stage(session, content, toAttachment(file));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(session));
    }

    /**
     * DELETE /meeting-log-api/v1/sessions/{sessionId}/cart — alles verwerfen
     */
    @DeleteMapping("/cart")
    public ResponseEntity<Void> discardAll(@PathVariable String sessionId) {
        stagingService.discardAll(sessionManager.require(sessionId));
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /meeting-log-api/v1/sessions/{sessionId}/commit — Warenkorb festschreiben.
     * Ein FATAL_STOP ist kein HTTP-Fehler, sondern steht im Body.
     */
    @PostMapping("/commit")
    public ResponseEntity<CommitResponse> commit(@PathVariable String sessionId,
                                                 @Valid @RequestBody CommitRequest req) {
        SessionContext session = sessionManager.require(sessionId);
        return ResponseEntity.ok(commitPipeline.commit(session, req.getMeetingDate(), session::setCommitProgress));
    }

    /**
     * GET /meeting-log-api/v1/sessions/{sessionId}/commit — Fortschritt eines laufenden Commits
     */
    @GetMapping("/commit")
    public ResponseEntity<CommitStatusResponse> commitStatus(@PathVariable String sessionId) {
        SessionContext session = sessionManager.require(sessionId);
        return ResponseEntity.ok(CommitStatusResponse.builder()
                .sessionId(session.getSessionId())
                .running(session.getCommitRunning().get())
                .lastProgress(session.getCommitProgress())
                .build());
    }

    /**
     * POST /meeting-log-api/v1/sessions/{sessionId}/commit/cancel
     */
    @PostMapping("/commit/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String sessionId) {
        boolean running = sessionManager.requestCancel(sessionId);
        return running ? ResponseEntity.accepted().build() : ResponseEntity.noContent().build();
    }

    private static Attachment toAttachment(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return null;
        }
        try {
            String mimeType = file.getContentType() != null ? file.getContentType() : MediaType.APPLICATION_OCTET_STREAM_VALUE;
            return new Attachment(file.getOriginalFilename(), mimeType, file.getBytes());
        } catch (IOException e) {
            throw new ValidationException("ATTACHMENT_UNREADABLE", "attachment could not be read: " + e.getMessage());
        }
    }

    private static CartResponse toResponse(SessionContext session) {
        List<CartItem> items = session.getCart().items();
        List<CartItemResponse> views = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            CartItem item = items.get(i);
            views.add(CartItemResponse.builder()
                    .position(i + 1)
                    .content(item.getContent())
                    .attachmentName(item.hasAttachment() ? item.getAttachment().getFilename() : null)
                    .build());
        }
        return CartResponse.builder()
                .sessionId(session.getSessionId())
                .size(views.size())
                .items(views)
                .build();
    }
}
