package de.jwiegmann.meetinglog.boundary;

import de.jwiegmann.meetinglog.boundary.dto.session.LoginRequest;
import de.jwiegmann.meetinglog.boundary.dto.session.LoginResponse;
import de.jwiegmann.meetinglog.control.SessionManager;
import de.jwiegmann.meetinglog.entity.SessionContext;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/meeting-log-api/v1/sessions")
public class SessionRestController {

    private final SessionManager sessionManager;

    public SessionRestController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * POST /meeting-log-api/v1/sessions — Login
     */
    @PostMapping
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest req) {

        SessionContext s = sessionManager.login(req.getDepartment(), req.getGroup(), req.getPassword());

        return ResponseEntity
                .created(URI.create("/meeting-log-api/v1/sessions/" + s.getSessionId()))
                .body(LoginResponse.builder()
                        .sessionId(s.getSessionId())
                        .department(s.getDepartment())
                        .group(s.getGroup())
                        .expiresAt(s.getExpiresAt())
                        .build());
    }

    /**
     * DELETE /meeting-log-api/v1/sessions/{sessionId} — Logout, verwirft den Warenkorb
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> logout(@PathVariable String sessionId) {
        sessionManager.logout(sessionId);
        return ResponseEntity.noContent().build();
    }
}
