package de.jwiegmann.meetinglog.control;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.dto.RelayUploadRequest;
import de.jwiegmann.meetinglog.control.exception.RelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Base64;
import java.util.List;

/**
 * Client für das Datei-Relay: schickt einen Anhang als Base64-JSON und bekommt eine öffentliche URL zurück.
 * <p>
 * Kein internes Retry. Ob ein Upload wiederholt wird, entscheidet der Aufrufer anhand von {@link RelayException.Kind}.
 *
 * <pre>
 * POST {relay-endpoint}
 * {"file": "&lt;base64&gt;", "filename": "...", "mimeType": "..."}
 *
 * 200 {"status": "success", "url": "..."}
 * 200 {"status": "error", "message": "..."}
 * </pre>
 */
@Slf4j
@Component
public class RelayUploadClient {

    static final String STATUS_SUCCESS = "success";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final URI endpoint;

    public RelayUploadClient(@Qualifier("relayRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             MeetingLogProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = properties.getRelay().getEndpoint();
    }

    /**
     * Lädt die Bytes über das Relay hoch.
     *
     * @return öffentliche URL der abgelegten Datei
     * @throws RelayException TRANSPORT, MALFORMED_RESPONSE oder APPLICATION_ERROR
     */
    public String upload(byte[] bytes, String filename, String mimeType) {
        RelayUploadRequest body = RelayUploadRequest.builder()
                .file(Base64.getEncoder().encodeToString(bytes))
                .filename(filename)
                .mimeType(mimeType)
                .build();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(endpoint, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException e) {
            throw new RelayException(RelayException.Kind.TRANSPORT,
                    "relay responded with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new RelayException(RelayException.Kind.TRANSPORT, "relay not reachable: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new RelayException(RelayException.Kind.TRANSPORT,
                    "relay responded with HTTP " + response.getStatusCode().value());
        }

        String url = parseResponse(response.getBody());
        log.info("Uploaded '{}' ({} bytes) via relay", filename, bytes.length);
        return url;
    }

    private String parseResponse(String body) {
        if (body == null || body.isBlank()) {
            throw new RelayException(RelayException.Kind.MALFORMED_RESPONSE, "relay returned an empty body");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RelayException(RelayException.Kind.MALFORMED_RESPONSE, "relay response is not JSON", e);
        }

        JsonNode status = json.path("status");
        if (!json.isObject() || !status.isTextual()) {
            throw new RelayException(RelayException.Kind.MALFORMED_RESPONSE, "relay response has no status field");
        }

        if (!STATUS_SUCCESS.equals(status.asText())) {
            String message = json.path("message").isTextual() ? json.path("message").asText() : "relay rejected the upload";
            throw new RelayException(RelayException.Kind.APPLICATION_ERROR, message);
        }

        JsonNode url = json.path("url");
        if (!url.isTextual() || url.asText().isBlank()) {
            throw new RelayException(RelayException.Kind.MALFORMED_RESPONSE, "relay success response without url");
        }
        return url.asText();
    }
}
