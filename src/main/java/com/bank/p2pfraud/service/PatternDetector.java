package com.bank.p2pfraud.service;

import com.bank.p2pfraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Display-only heuristics over a sender's recent history. The patterns are
 * recorded on the transaction for investigators and never change the score.
 */
@Component
public class PatternDetector {

    public static final String ROUND_AMOUNT = "Round amount";
    public static final String SEQUENTIAL_AMOUNTS = "Sequential amounts";
    public static final String REPETITIVE_DESCRIPTION = "Repetitive description";
    public static final String CARD_TESTING = "Possible card testing";

    private static final double CARD_TEST_AMOUNT = 10.0;

    /**
     * @param recent the sender's recent transactions, oldest first
     */
    public List<String> detect(double amount, String description, List<Transaction> recent) {
        List<String> patterns = new ArrayList<>();

        if (amount >= 100 && amount % 100 == 0) {
            patterns.add(ROUND_AMOUNT);
        }

        List<Transaction> last5 = tail(recent, 5);
        if (last5.size() >= 3 && isArithmeticProgression(last5)) {
            patterns.add(SEQUENTIAL_AMOUNTS);
        }

        if (description != null) {
            long sameDescription = tail(recent, 10).stream()
                    .map(Transaction::getDescription)
                    .filter(Objects::nonNull)
                    .filter(description::equals)
                    .count();
            if (sameDescription >= 3) {
                patterns.add(REPETITIVE_DESCRIPTION);
            }
        }

        long small = tail(recent, 20).stream()
                .filter(t -> t.getAmount() < CARD_TEST_AMOUNT)
                .count();
        if (small >= 5) {
            patterns.add(CARD_TESTING);
        }

        return patterns;
    }

    private static boolean isArithmeticProgression(List<Transaction> txns) {
        Set<Double> diffs = new HashSet<>();
        for (int i = 0; i < txns.size() - 1; i++) {
            diffs.add(txns.get(i + 1).getAmount() - txns.get(i).getAmount());
        }
        return diffs.size() == 1 && diffs.iterator().next() != 0.0;
    }

    private static List<Transaction> tail(List<Transaction> list, int n) {
        if (list == null) return List.of();
        return list.size() <= n ? list : list.subList(list.size() - n, list.size());
    }
}
