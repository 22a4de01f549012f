package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.boundary.dto.commit.CommitProgressEvent;

@FunctionalInterface
public interface CommitProgressListener {

    CommitProgressListener NONE = event -> { };

    void onProgress(CommitProgressEvent event);
}
