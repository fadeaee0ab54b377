package com.bank.p2pfraud.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fraudGuardOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("P2P Fraud Guard API")
                        .version("1.0.0")
                        .description(
                                "Risk scoring and investigation workflow for peer-to-peer payments.\n\n" +
                                "**Payment Pipeline:**\n" +
                                "1. Receive payment via `POST /payments`\n" +
                                "2. Check sender balance, compute rolling 1h/24h velocity\n" +
                                "3. Extract the 13-feature vector and score it with the random forest model\n" +
                                "4. Evaluate the weighted risk rules (amount, location, device, velocity, timing)\n" +
                                "5. Final score = 0.7 × model probability + 0.3 × rule score\n" +
                                "6. Outcome: **SETTLED** (< flag threshold), **FLAGGED** (funds move, case opened), " +
                                "**BLOCKED** (funds held, high-priority case)\n\n" +
                                "**Investigation:** admins assign cases to investigators, investigators resolve them as " +
                                "Safe (funds released) or Fraudulent (payment rejected).\n\n" +
                                "Caller identity is supplied by the upstream auth layer through the " +
                                "`X-Caller-Id` and `X-Caller-Role` headers.")
                        .contact(new Contact().name("Fraud Operations Team")));
    }
}
