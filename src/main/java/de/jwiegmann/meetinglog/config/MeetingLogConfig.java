package de.jwiegmann.meetinglog.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(MeetingLogProperties.class)
public class MeetingLogConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * RestTemplate für den Relay-Upload. Eigene Timeouts, da Anhänge mehrere MB groß sein können.
     */
    @Bean
    public RestTemplate relayRestTemplate(RestTemplateBuilder restTemplateBuilder, MeetingLogProperties properties) {
        return restTemplateBuilder
                .setConnectTimeout(properties.getRelay().getConnectTimeout())
                .setReadTimeout(properties.getRelay().getReadTimeout())
                .build();
    }
}
