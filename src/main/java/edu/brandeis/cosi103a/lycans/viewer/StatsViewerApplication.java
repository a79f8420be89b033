package edu.brandeis.cosi103a.lycans.viewer;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.lycans.report.ObjectMapperFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Main application class for the stats viewer.
 * Serves the reports of the game logs found in the data directory.
 */
@SpringBootApplication
public class StatsViewerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatsViewerApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }
}
