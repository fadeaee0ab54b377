package com.bank.p2pfraud.engine;

import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.Settings;
import com.bank.p2pfraud.model.VelocitySnapshot;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Runtime inputs to rule evaluators that are not part of the payment request itself.
 */
@Data
@Builder
public class EvaluationContext {
    // Policy snapshot taken once for the whole evaluation
    private Settings settings;

    private Account sender;

    // Sender's rolling usage before this payment (settled and under-review only)
    private VelocitySnapshot velocity;

    // Mean amount of the sender's most recent transactions, 0 when there is no history
    private double historicalAverageAmount;

    // Local wall-clock time of the submission
    private LocalDateTime submittedAt;
    private long submittedAtMillis;
}
