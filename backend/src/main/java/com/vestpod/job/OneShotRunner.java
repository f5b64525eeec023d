package com.vestpod.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * One-shot mode for external schedulers: {@code vestpod.run-once=price-update|alert-check|all} runs the job(s)
 * once, logs the summary and exits with 0, or 1 when a job threw.
 */
@Component
@ConditionalOnProperty(name = "vestpod.run-once")
@Slf4j
public class OneShotRunner implements ApplicationRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    private final PriceUpdateJob priceUpdateJob;
    private final AlertCheckJob alertCheckJob;
    private final ConfigurableApplicationContext context;
    private final String mode;

    public OneShotRunner(PriceUpdateJob priceUpdateJob,
                         AlertCheckJob alertCheckJob,
                         ConfigurableApplicationContext context,
                         @Value("${vestpod.run-once}") String mode) {
        this.priceUpdateJob = priceUpdateJob;
        this.alertCheckJob = alertCheckJob;
        this.context = context;
        this.mode = mode;
    }

    @Override
    public void run(ApplicationArguments args) {
        int code = execute(mode);
        System.exit(SpringApplication.exit(context, () -> code));
    }

    int execute(String requested) {
        String normalized = requested == null ? "" : requested.trim().toLowerCase(Locale.ROOT);
        try {
            RunSummary summary = switch (normalized) {
                case "price-update" -> priceUpdateJob.run();
                case "alert-check" -> alertCheckJob.run();
                case "all" -> priceUpdateJob.run().plus(alertCheckJob.run());
                default -> throw new IllegalArgumentException("Unknown vestpod.run-once mode: " + requested
                        + " (expected price-update, alert-check or all)");
            };
            log.info("One-shot run finished: {}", summary);
            return EXIT_OK;
        } catch (RuntimeException e) {
            log.error("One-shot run '{}' failed", requested, e);
            return EXIT_FAILED;
        }
    }
}
