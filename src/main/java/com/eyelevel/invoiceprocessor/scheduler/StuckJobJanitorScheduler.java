package com.eyelevel.invoiceprocessor.scheduler;

import com.eyelevel.invoiceprocessor.service.janitor.StuckJobJanitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically recovers documents stuck in the pipeline. See {@link StuckJobJanitorService}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StuckJobJanitorScheduler {

    private final StuckJobJanitorService janitorService;
    private final NonReentrantRunGuard runGuard = new NonReentrantRunGuard();

    @Scheduled(cron = "${app.scheduler.stuck-job-janitor}")
    public void recoverStuckJobs() {
        final boolean ran = runGuard.runExclusively(() -> {
            try {
                janitorService.runJanitorPass();
            } catch (RuntimeException e) {
                log.error("Janitor pass aborted.", e);
            }
        });
        if (!ran) {
            log.warn("Previous janitor pass still running; skipping this tick.");
        }
    }
}
