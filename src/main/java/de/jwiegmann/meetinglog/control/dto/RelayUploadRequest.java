package de.jwiegmann.meetinglog.control.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request-Body für das Relay: Datei als Base64-String plus Metadaten.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayUploadRequest {

    @ToString.Exclude
    private String file;

    private String filename;
    private String mimeType;
}
