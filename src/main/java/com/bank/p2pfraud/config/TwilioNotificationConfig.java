package com.bank.p2pfraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "notifications.twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;    // fraud operations desk
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"
}
