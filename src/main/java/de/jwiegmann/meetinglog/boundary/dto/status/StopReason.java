package de.jwiegmann.meetinglog.boundary.dto.status;

public enum StopReason {
    RATE_LIMITED,   // Quota erschöpft, später erneut versuchen
    STORE_ERROR,
    CANCELLED       // vom Benutzer an einer Item-Grenze abgebrochen
}
