package com.example.litigationhold;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Litigation Hold Enforcer Application
 * <p>
 * A batch command-line job that places every eligible directory mailbox
 * on litigation hold.
 * <p>
 * Features:
 * - Scale-aware batch size and concurrency advice
 * - Batched status reconciliation with per-subject fallback
 * - Bounded concurrent hold updates with a preview mode
 * - Error threshold halting at batch boundaries
 * - CSV report, JSON summary and Slack alerting
 */
@SpringBootApplication
public class LitigationHoldApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LitigationHoldApplication.class, args)));
    }
}
