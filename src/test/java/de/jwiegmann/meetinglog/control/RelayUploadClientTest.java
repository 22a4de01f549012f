package de.jwiegmann.meetinglog.control;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.exception.RelayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RelayUploadClientTest {

    private static final URI ENDPOINT = URI.create("http://relay.test/exec");

    private MockRestServiceServer server;
    private RelayUploadClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        MeetingLogProperties properties = new MeetingLogProperties();
        properties.getRelay().setEndpoint(ENDPOINT);
        client = new RelayUploadClient(restTemplate, new ObjectMapper(), properties);
    }

    @Test
    void upload_sends_exact_base64_and_returns_embedded_url() {
        byte[] bytes = "0123456789".getBytes(StandardCharsets.US_ASCII);

        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.file").value(Base64.getEncoder().encodeToString(bytes)))
                .andExpect(jsonPath("$.filename").value("scan.png"))
                .andExpect(jsonPath("$.mimeType").value("image/png"))
                .andRespond(withSuccess("{\"status\":\"success\",\"url\":\"https://drive.google.com/file/d/abc/view\"}",
                        MediaType.APPLICATION_JSON));

        String url = client.upload(bytes, "scan.png", "image/png");

        assertThat(url).isEqualTo("https://drive.google.com/file/d/abc/view");
        server.verify();
    }

    @Test
    void non_json_body_is_malformed_response() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("<html>Moved</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.upload(new byte[]{1}, "a.pdf", "application/pdf"))
                .isInstanceOf(RelayException.class)
                .satisfies(e -> {
                    RelayException relay = (RelayException) e;
                    assertThat(relay.getKind()).isEqualTo(RelayException.Kind.MALFORMED_RESPONSE);
                    assertThat(relay.isRetryable()).isTrue();
                });
    }

    @Test
    void error_status_is_application_error_carrying_message() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"status\":\"error\",\"message\":\"x\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.upload(new byte[]{1}, "a.pdf", "application/pdf"))
                .isInstanceOf(RelayException.class)
                .hasMessage("x")
                .satisfies(e -> {
                    RelayException relay = (RelayException) e;
                    assertThat(relay.getKind()).isEqualTo(RelayException.Kind.APPLICATION_ERROR);
                    assertThat(relay.isRetryable()).isFalse();
                });
    }

    @Test
    void non_2xx_status_is_transport_error() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError());

        assertThatThrownBy(() -> client.upload(new byte[]{1}, "a.pdf", "application/pdf"))
                .isInstanceOf(RelayException.class)
                .extracting("kind").isEqualTo(RelayException.Kind.TRANSPORT);
    }

    @Test
    void success_without_url_is_malformed_response() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"status\":\"success\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.upload(new byte[]{1}, "a.pdf", "application/pdf"))
                .isInstanceOf(RelayException.class)
                .extracting("kind").isEqualTo(RelayException.Kind.MALFORMED_RESPONSE);
    }

    @Test
    void json_array_is_malformed_response() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("[\"success\"]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.upload(new byte[]{1}, "a.pdf", "application/pdf"))
                .isInstanceOf(RelayException.class)
                .extracting("kind").isEqualTo(RelayException.Kind.MALFORMED_RESPONSE);
    }
}
