package de.jwiegmann.meetinglog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetingLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetingLogApplication.class, args);
    }
}
