package com.bank.p2pfraud.engine.model;

import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.VelocitySnapshot;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts the 13-dimensional feature vector consumed by the fraud scorer.
 *
 * Features:
 *   [0]  Amount
 *   [1]  Hour of day (0-23)
 *   [2]  Day of week (0 = Monday .. 6 = Sunday)
 *   [3]  Failed authentication attempts
 *   [4]  Unusual location: 1 if the declared location is in the high-risk set
 *   [5]  Device risk: 1 if the device string is exactly emulator / rooted / unknown
 *   [6]  Amount sent in the last hour
 *   [7]  Amount sent in the last 24 hours
 *   [8]  Payments sent in the last hour
 *   [9]  Payments sent in the last 24 hours
 *   [10] Recipient new: 1 if the sender never paid this recipient before
 *   [11] Sender balance ratio: amount / balance, capped at 1.0 (1.0 when balance <= 0)
 *   [12] Round amount: 1 if the amount is a multiple of 100 and at least 100
 *
 * The trained scorer depends on this exact layout. Changing it means retraining.
 */
public class FeatureExtractor {

    public static final int FEATURE_COUNT = 13;

    public static final String[] FEATURE_NAMES = {
            "amount",
            "hour",
            "day_of_week",
            "failed_attempts",
            "unusual_location",
            "device_risk",
            "amount_velocity_1h",
            "amount_velocity_24h",
            "tx_count_1h",
            "tx_count_24h",
            "recipient_new",
            "sender_balance_ratio",
            "round_amount"
    };

    private static final Set<String> RISKY_DEVICES = Set.of("emulator", "rooted", "unknown");

    private FeatureExtractor() {}

    public static double[] extract(PaymentRequest request,
                                   LocalDateTime submittedAt,
                                   double senderBalance,
                                   boolean recipientNew,
                                   VelocitySnapshot velocity,
                                   Collection<String> highRiskLocations) {
        double[] features = new double[FEATURE_COUNT];
        double amount = request.getAmount();

        features[0] = amount;
        features[1] = submittedAt.getHour();
        features[2] = submittedAt.getDayOfWeek().getValue() - 1;
        features[3] = request.getFailedAttempts();
        features[4] = request.getLocation() != null && highRiskLocations.contains(request.getLocation()) ? 1.0 : 0.0;

        String device = request.getDeviceSignature() != null
                ? request.getDeviceSignature().toLowerCase(Locale.ROOT) : "";
        features[5] = RISKY_DEVICES.contains(device) ? 1.0 : 0.0;

        // Missing aggregates count as no activity
        if (velocity != null) {
            features[6] = velocity.getAmount1h();
            features[7] = velocity.getAmount24h();
            features[8] = velocity.getCount1h();
            features[9] = velocity.getCount24h();
        }

        features[10] = recipientNew ? 1.0 : 0.0;
        features[11] = senderBalance > 0 ? Math.min(amount / senderBalance, 1.0) : 1.0;
        features[12] = amount >= 100 && amount % 100 == 0 ? 1.0 : 0.0;

        return features;
    }
}
