package de.jwiegmann.meetinglog.entity;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class CacheSnapshot {

    List<DirectoryEntry> directory;
    List<MeetingRecord> records;
    Instant fetchedAt;
}
