package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.exception.ValidationException;
import de.jwiegmann.meetinglog.entity.Attachment;
import de.jwiegmann.meetinglog.entity.CartItem;
import de.jwiegmann.meetinglog.entity.SessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StagingServiceTest {

    private StagingService stagingService;
    private SessionContext session;

    @BeforeEach
    void setUp() {
        MeetingLogProperties properties = new MeetingLogProperties();
        properties.getAttachments().setMaxSize(DataSize.ofBytes(16));
        stagingService = new StagingService(properties);
        session = SessionContext.builder().sessionId("s-1").department("Office A").group("G1").build();
    }

    @Test
    void empty_content_is_rejected_and_cart_stays_unchanged() {
        assertThatThrownBy(() -> stagingService.stage(session, "", null))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo("EMPTY_CONTENT");
        assertThatThrownBy(() -> stagingService.stage(session, null, null))
                .isInstanceOf(ValidationException.class);

        assertThat(stagingService.items(session)).isEmpty();
    }

    @Test
    void stage_appends_in_fifo_order() {
        stagingService.stage(session, "erster", null);
        stagingService.stage(session, "zweiter", new Attachment("foto.JPG", "image/jpeg", new byte[]{1, 2, 3}));
        stagingService.stage(session, "dritter", null);

        assertThat(stagingService.items(session))
                .extracting(CartItem::getContent)
                .containsExactly("erster", "zweiter", "dritter");
        assertThat(stagingService.items(session).get(1).hasAttachment()).isTrue();
    }

    @Test
    void items_is_a_restartable_read_only_view() {
        stagingService.stage(session, "eins", null);

        assertThat(stagingService.items(session)).isEqualTo(stagingService.items(session));
        assertThatThrownBy(() -> stagingService.items(session).clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(stagingService.items(session)).hasSize(1);
    }

    @Test
    void discard_all_is_idempotent() {
        stagingService.stage(session, "eins", null);

        stagingService.discardAll(session);
        stagingService.discardAll(session);

        assertThat(stagingService.items(session)).isEmpty();
    }

    @Test
    void attachment_with_disallowed_extension_is_rejected() {
        Attachment exe = new Attachment("tool.exe", "application/octet-stream", new byte[]{1});

        assertThatThrownBy(() -> stagingService.stage(session, "text", exe))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo("ATTACHMENT_TYPE_NOT_ALLOWED");
    }

    @Test
    void attachment_over_size_limit_is_rejected() {
        Attachment big = new Attachment("scan.pdf", "application/pdf", new byte[17]);

        assertThatThrownBy(() -> stagingService.stage(session, "text", big))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo("ATTACHMENT_TOO_LARGE");
    }
}
