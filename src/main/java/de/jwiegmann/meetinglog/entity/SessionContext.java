package de.jwiegmann.meetinglog.entity;

import de.jwiegmann.meetinglog.boundary.dto.commit.CommitProgressEvent;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Zustand einer angemeldeten Session: Identität, Warenkorb und Commit-Flags.
 * Entsteht beim Login, wird beim Logout verworfen.
 */
@Getter
@Builder
public class SessionContext {

    private final String sessionId;
    private final String department;
    private final String group;
    private final LocalDateTime createdAt;

    @Setter
    private volatile LocalDateTime expiresAt;

    /** Letzter Fortschritt des laufenden bzw. zuletzt gelaufenen Commits. */
    @Setter
    private volatile CommitProgressEvent commitProgress;

    @Builder.Default
    private final Cart cart = new Cart();

    @Builder.Default
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    @Builder.Default
    private final AtomicBoolean commitRunning = new AtomicBoolean(false);

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
