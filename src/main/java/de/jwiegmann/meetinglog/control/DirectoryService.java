package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.entity.DirectoryEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Lookup auf der Zugangsliste. Liest ausschließlich über den SnapshotCache.
 */
@Service
@RequiredArgsConstructor
public class DirectoryService {

    private final SnapshotCache snapshotCache;

    /**
     * Exakter, case-sensitiver Vergleich aller drei Felder in Store-Reihenfolge.
     * Das Passwort wird im Klartext verglichen.
     *
     * @return true, wenn eine Zeile mit genau diesen Werten existiert
     */
    public boolean authenticate(String department, String group, String secret) {
        if (department == null || group == null || secret == null) {
            return false;
        }
        return snapshotCache.get().getDirectory().stream()
                .anyMatch(entry -> entry.matches(department, group, secret));
    }

    public List<String> departments() {
        return snapshotCache.get().getDirectory().stream()
                .map(DirectoryEntry::getDepartment)
                .distinct()
                .toList();
    }

    public List<String> groups(String department) {
        return snapshotCache.get().getDirectory().stream()
                .filter(entry -> Objects.equals(entry.getDepartment(), department))
                .map(DirectoryEntry::getGroup)
                .distinct()
                .toList();
    }
}
