package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.repository.InMemorySessionRepository;
import de.jwiegmann.meetinglog.entity.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Verwaltet Sessions: Login gegen die Zugangsliste, Logout und Expiry.
 */
@Slf4j
@Component
public class SessionManager {

    private final InMemorySessionRepository sessionRepository;
    private final DirectoryService directoryService;
    private final Clock clock;
    private final Duration idleTimeout;

    public SessionManager(InMemorySessionRepository sessionRepository,
                          DirectoryService directoryService,
                          Clock clock,
                          MeetingLogProperties properties) {
        this.sessionRepository = sessionRepository;
        this.directoryService = directoryService;
        this.clock = clock;
        this.idleTimeout = properties.getSession().getIdleTimeout();
    }

    /**
     * Meldet eine Abteilung/Gruppe an und erzeugt einen neuen Session-Kontext mit leerem Warenkorb.
     *
     * @throws ResponseStatusException 401 bei unbekannter Kombination oder falschem Passwort
     */
    public SessionContext login(String department, String group, String secret) {

        if (!directoryService.authenticate(department, group, secret)) {
            log.warn("Login rejected for {} / {}", department, group);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "invalid credentials");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        SessionContext session = SessionContext.builder()
                .sessionId(UUID.randomUUID().toString())
                .department(department)
                .group(group)
                .createdAt(now)
                .expiresAt(now.plus(idleTimeout))
                .build();

        log.info("Session {} opened for {} / {}", session.getSessionId(), department, group);
        return sessionRepository.save(session);
    }

    /**
     * Verwirft den Session-Kontext samt Warenkorb. Mehrfacher Aufruf ist erlaubt.
     */
    public void logout(String sessionId) {
        sessionRepository.remove(sessionId).ifPresent(session -> {
            session.getCart().clear();
            log.info("Session {} closed", sessionId);
        });
    }

    /**
     * Lädt eine aktive Session und verlängert ihre Laufzeit.
     *
     * @throws ResponseStatusException 404 wenn unbekannt, 410 wenn abgelaufen
     */
    public SessionContext require(String sessionId) {

        SessionContext session = sessionRepository.find(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "session not found"));

        LocalDateTime now = LocalDateTime.now(clock);
        if (session.isExpired(now)) {
            sessionRepository.remove(sessionId);
            session.getCart().clear();
            throw new ResponseStatusException(HttpStatus.GONE, "session expired");
        }

        session.setExpiresAt(now.plus(idleTimeout));
        return session;
    }

    /**
     * Fordert den Abbruch eines laufenden Commits an. Greift erst an der nächsten Item-Grenze.
     *
     * @return true, wenn gerade ein Commit läuft
     */
    public boolean requestCancel(String sessionId) {
        SessionContext session = require(sessionId);
        if (!session.getCommitRunning().get()) {
            return false;
        }
        session.getCancelRequested().set(true);
        log.info("Cancel requested for commit of session {}", sessionId);
        return true;
    }

    /**
     * Räumt abgelaufene Sessions samt Warenkorb weg, auch wenn sie nie wieder angefragt werden.
     * Sessions mit laufendem Commit bleiben stehen.
     *
     * @return Anzahl entfernter Sessions
     */
    @Scheduled(fixedDelayString = "${meeting-log.session.sweep-interval:PT5M}")
    public int evictExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<SessionContext> expired = sessionRepository.removeIf(
                session -> session.isExpired(now) && !session.getCommitRunning().get());
        expired.forEach(session -> session.getCart().clear());
        if (!expired.isEmpty()) {
            log.info("Evicted {} expired session(s)", expired.size());
        }
        return expired.size();
    }
}
