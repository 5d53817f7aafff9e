package com.example.litigationhold.runner;

import com.example.litigationhold.exception.PreconditionFailedException;
import com.example.litigationhold.service.LitigationHoldRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs a single enforcement pass at startup and turns its result into the process exit code.
 * <p>
 * 0 when the run completed, even with failed subjects. 1 when it halted on the error
 * threshold, failed a precondition or died unexpectedly.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "litigation-hold.runner.enabled", havingValue = "true", matchIfMissing = true)
public class LitigationHoldRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FATAL = 1;

    private final LitigationHoldRunService runService;

    private int exitCode = EXIT_SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        try {
            var summary = runService.execute().getSummary();
            if (summary.isHalted()) {
                log.error("Run {} halted: {}", summary.getRunId(), summary.getHaltReason());
                exitCode = EXIT_FATAL;
            } else {
                exitCode = EXIT_SUCCESS;
            }
        } catch (PreconditionFailedException e) {
            log.error("Precondition failed, nothing was processed: {}", e.getMessage());
            exitCode = EXIT_FATAL;
        } catch (Exception e) {
            log.error("Run failed unexpectedly: {}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
