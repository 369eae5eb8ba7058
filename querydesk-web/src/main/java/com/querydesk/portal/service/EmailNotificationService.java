package com.querydesk.portal.service;

import com.querydesk.portal.event.QueryRespondedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Emails guests when an admin responds to their query. Students are notified in-app through the
 * {@code responseSeen} flag instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailNotificationService {

    private final JavaMailSender mailSender;

    @Value("${app.mail.enabled:true}")
    private boolean enabled = true;

    @Value("${app.mail.from:noreply@querydesk.local}")
    private String from = "noreply@querydesk.local";

    @Value("${app.base-url:http://localhost:8080}")
    private String baseUrl = "http://localhost:8080";

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onQueryResponded(QueryRespondedEvent event) {
        if (!event.guest()) {
            log.debug("Query {} belongs to a student, reply is shown in-app", event.queryId());
            return;
        }
        sendResponseEmail(event);
    }

    void sendResponseEmail(QueryRespondedEvent event) {
        if (!enabled) {
            log.debug("Mail disabled, skipping response email for query {}", event.queryId());
            return;
        }
        if (event.requesterEmail() == null || event.requesterEmail().isEmpty()) {
            log.warn("Skipping email notification: No recipient address.");
            return;
        }

        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(from);
            message.setTo(event.requesterEmail());
            message.setSubject("Your query update - Status: " + event.status().getValue());
            message.setText(buildBody(event));
            mailSender.send(message);
            log.info("Response email sent to {} for query {}", event.requesterEmail(), event.queryId());
        } catch (Exception e) {
            log.warn("Failed to send email to {}: {}", event.requesterEmail(), e.getMessage());
        }
    }

    String buildBody(QueryRespondedEvent event) {
        return "Hello " + event.requesterName() + ",\n\n" +
                "Your query has been updated.\n\n" +
                "Category: " + (event.category() != null ? event.category() : "General") + "\n" +
                "Message: " + event.message() + "\n" +
                "Admin Response: " + event.adminResponse() + "\n" +
                "Status: " + event.status().getValue() + "\n\n" +
                "Frequently asked questions: " + baseUrl + "/api/faqs\n\n" +
                "Thank you,\nThe Admin Team\n";
    }
}
