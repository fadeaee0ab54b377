package com.bank.p2pfraud.engine.evaluators;

import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.VelocitySnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.bank.p2pfraud.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class TransactionAmountEvaluatorTest {

    private final TransactionAmountEvaluator evaluator = new TransactionAmountEvaluator();
    private final EvaluationContext context = createEvaluationContext(
            createAccount(SENDER_ID, AccountRole.CUSTOMER, 0.0), VelocitySnapshot.empty(), 0.0);

    @Test
    void overLimit_usesLivePolicyLimitInFactor() {
        context.getSettings().setTxLimitAmount(2500.0);

        RuleResult result = evaluator.evaluate(createPaymentRequest(SENDER_ID, RECIPIENT_ID, 2600.0), context);

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getContribution()).isEqualTo(TransactionAmountEvaluator.OVER_LIMIT_WEIGHT);
        assertThat(result.getFactor()).isEqualTo("Large transaction amount exceeds $2500 limit");
    }

    @Test
    void exactlyAtLimit_isOnlySignificant() {
        RuleResult result = evaluator.evaluate(createPaymentRequest(SENDER_ID, RECIPIENT_ID, 5000.0), context);

        assertThat(result.getContribution()).isEqualTo(TransactionAmountEvaluator.SIGNIFICANT_WEIGHT);
        assertThat(result.getFactor()).isEqualTo("Significant transaction amount over $1,000");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.5, 50.0, 1000.0})
    void upToOneThousand_notTriggered(double amount) {
        RuleResult result = evaluator.evaluate(createPaymentRequest(SENDER_ID, RECIPIENT_ID, amount), context);

        assertThat(result.isTriggered()).isFalse();
        assertThat(result.getFactor()).isNull();
    }
}
