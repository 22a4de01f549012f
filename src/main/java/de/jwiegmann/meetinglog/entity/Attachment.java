package de.jwiegmann.meetinglog.entity;

import lombok.ToString;
import lombok.Value;

@Value
public class Attachment {

    String filename;
    String mimeType;

    @ToString.Exclude
    byte[] content;

    public int size() {
        return content.length;
    }
}
