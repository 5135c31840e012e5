package de.htwsaar.socialnet.media;

import de.htwsaar.socialnet.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({LoggingConfig.class})
public class MediaApp {
    public static void main(String[] args) {
        SpringApplication.run(MediaApp.class, args);
    }
}
