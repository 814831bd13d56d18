package com.easydev.mail;

import com.easydev.mail.config.MailConfig;
import com.easydev.mail.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mail Dispatch Service startup check.
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Load and validate configuration</li>
 *   <li>Build the mail service (primary and optional fallback transporters)</li>
 *   <li>Verify the SMTP connection with back-off and fallback</li>
 *   <li>Register JVM shutdown hook that drains the connection pools</li>
 * </ol>
 * Exits with status 1 when configuration is invalid or verification fails.
 */
public class MailDispatchApp {

    private static final Logger LOG = LoggerFactory.getLogger(MailDispatchApp.class);

    public static void main(final String[] args) {
        LOG.info("=================================================");
        LOG.info("  Mail Dispatch Service  v1.0.0");
        LOG.info("=================================================");

        // ── 1. Configuration and service ──────────────────────────────────────
        final MailService service;
        try {
            service = new MailService(MailConfig.load());
        } catch (RuntimeException e) {
            LOG.error("Email configuration is invalid, refusing to start: {}", e.getMessage());
            System.exit(1);
            return;
        }

        // ── 2. Shutdown hook ──────────────────────────────────────────────────
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown hook triggered, closing mail service...");
            service.close();
        }, "shutdown-hook"));

        // ── 3. Verification ───────────────────────────────────────────────────
        final VerificationResult result = service.verifyEmailConnection();
        LOG.info("Verification result: {}", result);
        LOG.info("Metrics: {}", result.getMetrics().asMap());

        if (!result.isSuccess()) {
            LOG.error("Email service is not reachable: {}", result.getDetail());
            System.exit(1);
        }
        LOG.info("Email service is ready{}.", result.isUsedFallback() ? " (using fallback provider)" : "");
    }
}
