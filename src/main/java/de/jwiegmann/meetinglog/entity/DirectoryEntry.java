package de.jwiegmann.meetinglog.entity;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Eine Zeile der Zugangsliste: Abteilung, Gruppe und gemeinsames Passwort.
 */
@Value
@Builder
public class DirectoryEntry {

    String department;
    String group;

    @ToString.Exclude
    String secret;

    public boolean matches(String department, String group, String secret) {
        return this.department.equals(department)
                && this.group.equals(group)
                && this.secret.equals(secret);
    }
}
