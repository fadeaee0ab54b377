package com.bank.p2pfraud.service;

import com.bank.p2pfraud.config.MetricsConfig;
import com.bank.p2pfraud.config.TwilioNotificationConfig;
import com.bank.p2pfraud.model.InvestigationCase;
import com.bank.p2pfraud.model.Transaction;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final SettingsService settingsService;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config,
                                     SettingsService settingsService,
                                     MetricsConfig metricsConfig) {
        this.config = config;
        this.settingsService = settingsService;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-blocked-notification")
    public void notifyPaymentBlocked(Transaction txn, double finalScore, List<String> riskFactors) {
        if (!isActive()) {
            return;
        }

        String topFactor = riskFactors == null || riskFactors.isEmpty() ? "N/A" : riskFactors.get(0);
        String body = String.format(
                "[FRAUD ALERT] Payment BLOCKED\n" +
                "Sender: %s\n" +
                "Txn ID: %s\n" +
                "Amount: $%.2f\n" +
                "Risk Score: %.2f\n" +
                "Top Factor: %s",
                txn.getSenderId(),
                txn.getTxnId(),
                txn.getAmount(),
                finalScore,
                topFactor
        );
        send(txn.getTxnId(), body);
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-fraud-notification")
    public void notifyFraudConfirmed(Transaction txn, InvestigationCase investigationCase) {
        if (!isActive()) {
            return;
        }

        String body = String.format(
                "[FRAUD CONFIRMED] Payment rejected\n" +
                "Sender: %s\n" +
                "Txn ID: %s\n" +
                "Amount: $%.2f\n" +
                "Case: %s (investigator %s)",
                txn.getSenderId(),
                txn.getTxnId(),
                txn.getAmount(),
                investigationCase.getCaseId(),
                investigationCase.getAssignedTo() != null ? investigationCase.getAssignedTo() : "admin"
        );
        send(txn.getTxnId(), body);
    }

    private boolean isActive() {
        return config.isEnabled() && settingsService.getSettings().isEnableNotifications();
    }

    private void send(String txnId, String body) {
        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio notification sent for txn={}, sid={}", txnId, message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio notification for txn={}: {}", txnId, e.getMessage(), e);
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
