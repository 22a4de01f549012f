package de.jwiegmann.meetinglog.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externe Konfiguration unter dem Prefix {@code meeting-log}.
 * Alle Werte sind injizierbar, nichts davon ist in der Commit-Pipeline hart verdrahtet.
 */
@Data
@ConfigurationProperties(prefix = "meeting-log")
public class MeetingLogProperties {

    private final Relay relay = new Relay();
    private final Store store = new Store();
    private final Cache cache = new Cache();
    private final Session session = new Session();
    private final Attachments attachments = new Attachments();

    @Data
    public static class Relay {
        private URI endpoint = URI.create("http://localhost:8089/relay");
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
        private boolean timestampFilenames = true;
    }

    @Data
    public static class Store {
        private String id = "School_Meeting_System";

        @ToString.Exclude
        private String credential = "";

        private String directoryTable = "config";
        private String recordsTable = "records";

        // 0 = unbegrenzt
        private int readQuotaPerMinute;
        private int writeQuotaPerMinute;

        private List<DirectorySeed> directory = new ArrayList<>();
    }

    @Data
    public static class DirectorySeed {
        private String department;
        private String group;

        @ToString.Exclude
        private String password;
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(60);
    }

    @Data
    public static class Session {
        private Duration idleTimeout = Duration.ofHours(2);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Attachments {
        private List<String> allowedExtensions = new ArrayList<>(List.of("png", "jpg", "jpeg", "pdf"));
        private DataSize maxSize = DataSize.ofMegabytes(10);
    }
}
