package com.example.inventoryjobs.client;

import com.example.inventoryjobs.client.ClientModels.SendEmailRequest;
import com.example.inventoryjobs.client.ClientModels.SendEmailResponse;
import com.example.inventoryjobs.config.EmailProperties;
import com.example.inventoryjobs.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Email sender backed by an HTTP mail API.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - WebClient for HTTP calls
 * <p>
 * No retry here: a failed send fails the reminder task and the broker retries it.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "notifications.email", name = "enabled", havingValue = "true")
public class HttpEmailSender implements EmailSender {

    private static final String SERVICE_NAME = "Email API";
    private static final DateTimeFormatter DUE_DATE_FORMAT = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US).withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final EmailProperties properties;

    public HttpEmailSender(@Qualifier("emailWebClient") WebClient webClient, EmailProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "emailApi", fallbackMethod = "sendLoanReminderFallback")
    public void sendLoanReminder(String to, String borrowerName, String itemName, Instant dueDate, boolean isOverdue) {
        var request = buildLoanReminder(to, borrowerName, itemName, dueDate, isOverdue);
        log.debug("Sending loan reminder email for item '{}'", itemName);

        try {
            var response = webClient.post()
                    .uri("/emails")
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(SendEmailResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
            log.info("Loan reminder email accepted (id: {})", response != null ? response.getId() : "n/a");
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            throw new ExternalServiceException(SERVICE_NAME, e.getMessage(), e);
        }
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private void sendLoanReminderFallback(String to, String borrowerName, String itemName, Instant dueDate, boolean isOverdue, Exception e) {
        if (e instanceof ExternalServiceException ese) {
            throw ese;
        }
        log.warn("Circuit breaker open for {}, item: {}, error: {}", SERVICE_NAME, itemName, e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    SendEmailRequest buildLoanReminder(String to, String borrowerName, String itemName, Instant dueDate, boolean isOverdue) {
        var date = DUE_DATE_FORMAT.format(dueDate);
        var subject = isOverdue
                ? "Overdue: " + itemName + " was due on " + date
                : "Reminder: " + itemName + " is due on " + date;
        var text = String.format("Hi %s,%n%n%s %s %s.%n", borrowerName,
                itemName, isOverdue ? "was due on" : "is due on", date);
        var html = "<p>Hi " + HtmlUtils.htmlEscape(borrowerName) + ",</p>"
                + "<p><strong>" + HtmlUtils.htmlEscape(itemName) + "</strong> "
                + (isOverdue ? "was due on " : "is due on ") + date + ".</p>"
                + "<p>Please return it at your earliest convenience.</p>";

        return SendEmailRequest.builder()
                .from(properties.getFrom())
                .to(List.of(to))
                .subject(subject)
                .text(text)
                .html(html)
                .build();
    }
}
