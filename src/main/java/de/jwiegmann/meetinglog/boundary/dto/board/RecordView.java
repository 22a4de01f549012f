package de.jwiegmann.meetinglog.boundary.dto.board;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordView {
    private String id;
    private LocalDateTime submittedAt;
    private String group;
    private String content;
    private String attachmentUrl;
    private String previewUrl;
}
