package com.patcharbiter.selector;

import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.service.EvaluationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SelectorApplication {

    private static final Logger log = LoggerFactory.getLogger(SelectorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SelectorApplication.class, args);
    }

    /**
     * Batch mode: with {@code selector.run-on-startup=true} a full run starts
     * as soon as the application is up. Progress can then be polled at
     * {@code GET /evaluations/status}.
     *
     * To run:
     *   ANTHROPIC_API_KEY=sk-ant-... mvn spring-boot:run \
     *     -Dspring-boot.run.arguments="--selector.run-on-startup=true"
     */
    @Bean
    ApplicationRunner evaluateOnStartup(SelectorProperties properties, EvaluationService evaluations) {
        return args -> {
            if (properties.runOnStartup()) {
                log.info("selector.run-on-startup is set, starting a full run: {}", evaluations.startAll());
            }
        };
    }
}
