package de.jwiegmann.meetinglog.boundary.dto.status;

public enum CommitOutcome {
    SUCCESS,
    FATAL_STOP
}
