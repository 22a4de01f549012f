package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.boundary.dto.commit.CommitItemResult;
import de.jwiegmann.meetinglog.boundary.dto.commit.CommitProgressEvent;
import de.jwiegmann.meetinglog.boundary.dto.commit.CommitResponse;
import de.jwiegmann.meetinglog.boundary.dto.error.ApiError;
import de.jwiegmann.meetinglog.boundary.dto.status.CommitItemStatus;
import de.jwiegmann.meetinglog.boundary.dto.status.CommitOutcome;
import de.jwiegmann.meetinglog.boundary.dto.status.StopReason;
import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.exception.StoreException;
import de.jwiegmann.meetinglog.control.exception.StoreRateLimitedException;
import de.jwiegmann.meetinglog.control.exception.ValidationException;
import de.jwiegmann.meetinglog.control.repository.RecordStore;
import de.jwiegmann.meetinglog.entity.CartItem;
import de.jwiegmann.meetinglog.entity.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Schreibt den Warenkorb einer Session als Records in den Store, streng in Warenkorb-Reihenfolge.
 * <p>
 * Ablauf pro Eintrag: Anhang hochladen (Fehler nur melden), Record bauen, Append, Fortschritt melden.
 * Ein fehlgeschlagener Append stoppt den Lauf sofort (FATAL_STOP). Bereits geschriebene Records bleiben
 * bestehen und der Warenkorb wird nicht geleert, ein erneuter Commit schreibt sie also doppelt.
 * Nur ein vollständig erfolgreicher Lauf entfernt die committeten Einträge aus dem Warenkorb;
 * während des Laufs gestagte Einträge bleiben für den nächsten Commit stehen.
 */
@Slf4j
@Service
public class BatchCommitPipeline {

    private final CommitItemProcessor itemProcessor;
    private final RecordStore recordStore;
    private final RowMapper rowMapper;
    private final SnapshotCache snapshotCache;
    private final Clock clock;
    private final String recordsTable;

    public BatchCommitPipeline(CommitItemProcessor itemProcessor,
                               RecordStore recordStore,
                               RowMapper rowMapper,
                               SnapshotCache snapshotCache,
                               Clock clock,
                               MeetingLogProperties properties) {
        this.itemProcessor = itemProcessor;
        this.recordStore = recordStore;
        this.rowMapper = rowMapper;
        this.snapshotCache = snapshotCache;
        this.clock = clock;
        this.recordsTable = properties.getStore().getRecordsTable();
    }

    /**
     * Führt einen Commit-Lauf für den aktuellen Warenkorb aus.
     *
     * @param session     Session mit Identität und Warenkorb
     * @param meetingDate Sitzungsdatum für alle Records dieses Laufs
     * @param listener    wird nach jedem Eintrag aufgerufen
     * @return CommitResponse mit Outcome SUCCESS oder FATAL_STOP
     * @throws ValidationException     bei fehlendem Datum oder leerem Warenkorb
     * @throws ResponseStatusException 409 wenn für diese Session bereits ein Commit läuft
     */
    public CommitResponse commit(SessionContext session, LocalDate meetingDate, CommitProgressListener listener) {

        if (meetingDate == null) {
            throw new ValidationException("MISSING_MEETING_DATE", "meeting date is required");
        }
        if (!session.getCommitRunning().compareAndSet(false, true)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "commit already running for this session");
        }

        try {
            session.setCommitProgress(null);
            List<CartItem> items = session.getCart().items();
            if (items.isEmpty()) {
                throw new ValidationException("EMPTY_CART", "cart is empty");
            }
            session.getCancelRequested().set(false);
            return run(session, items, meetingDate, listener);
        } finally {
            session.getCommitRunning().set(false);
        }
    }

    private CommitResponse run(SessionContext session, List<CartItem> items, LocalDate meetingDate,
                               CommitProgressListener listener) {

        int total = items.size();
        int appended = 0;
        int processed = 0;
        List<CommitItemResult> results = new ArrayList<>();
        List<CommitProgressEvent> progress = new ArrayList<>();

        StopReason stopReason = null;
        Integer failedPosition = null;
        ApiError stopError = null;

        log.info("Commit of {} item(s) for session {} started (meeting {})", total, session.getSessionId(), meetingDate);

        for (int i = 0; i < total; i++) {
            int position = i + 1;

            // 1. Abbruch nur an der Item-Grenze
            if (session.getCancelRequested().getAndSet(false)) {
                stopReason = StopReason.CANCELLED;
                failedPosition = position;
                stopError = CommitErrorFactory.commitCancelled(position);
                break;
            }

            // 2. Anhang + Record
            CommitItemProcessor.PreparedItem prepared =
                    itemProcessor.prepare(session, items.get(i), meetingDate, LocalDateTime.now(clock));

            CommitItemResult.CommitItemResultBuilder result = CommitItemResult.builder()
                    .position(position)
                    .recordId(prepared.getRecord().getId())
                    .attachmentUrl(prepared.getRecord().getAttachmentUrl());
            if (prepared.attachmentFailed()) {
                result.attachmentError(CommitErrorFactory.attachmentUploadFailed(position, prepared.getAttachmentError()));
            }

            // 3. Append
            boolean ok = false;
            try {
                recordStore.appendRow(recordsTable, rowMapper.toRow(prepared.getRecord()));
                snapshotCache.invalidate();
                ok = true;
                appended++;
                result.status(CommitItemStatus.APPENDED);
            } catch (StoreRateLimitedException e) {
                stopReason = StopReason.RATE_LIMITED;
                stopError = CommitErrorFactory.storeRateLimited(e);
            } catch (StoreException e) {
                stopReason = StopReason.STORE_ERROR;
                stopError = CommitErrorFactory.storeFailed(e);
            }
            processed++;

            if (!ok) {
                failedPosition = position;
                result.status(CommitItemStatus.FAILED).recordId(null).error(stopError);
                log.warn("Commit for session {} stopped at item {}/{}: {}", session.getSessionId(), position, total, stopReason);
            }
            results.add(result.build());

            // 4. Fortschritt, auch für den fehlgeschlagenen Eintrag
            CommitProgressEvent event = CommitProgressEvent.builder()
                    .position(position)
                    .total(total)
                    .fraction((double) position / total)
                    .appended(ok)
                    .attachmentFailed(prepared.attachmentFailed())
                    .build();
            progress.add(event);
            listener.onProgress(event);

            if (!ok) {
                break;
            }
        }

        CommitResponse.CommitResponseBuilder response = CommitResponse.builder()
                .sessionId(session.getSessionId())
                .total(total)
                .processed(processed)
                .appended(appended)
                .progress(progress);

        // 5. Erfolg: nur die committeten Einträge aus dem Warenkorb nehmen
        if (stopReason == null) {
            session.getCart().removeCommitted(items);
            log.info("Commit for session {} finished: {} record(s) appended", session.getSessionId(), appended);
            return response.outcome(CommitOutcome.SUCCESS).items(results).build();
        }

        // 6. FATAL_STOP: Warenkorb bleibt unverändert
        for (int position = results.size() + 1; position <= total; position++) {
            results.add(CommitItemResult.builder()
                    .position(position)
                    .status(CommitItemStatus.SKIPPED)
                    .error(CommitErrorFactory.itemNotAttempted(position))
                    .build());
        }

        return response.outcome(CommitOutcome.FATAL_STOP)
                .stopReason(stopReason)
                .failedPosition(failedPosition)
                .error(stopError)
                .duplicationWarning(appended > 0 ? duplicationWarning(appended) : null)
                .items(results)
                .build();
    }

    private static String duplicationWarning(int appended) {
        return "Items 1.." + appended + " were already saved but are still in the cart. "
                + "Committing the cart again will save them a second time.";
    }
}
