package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.engine.model.FraudScorer;
import com.bank.p2pfraud.model.ModelStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/model")
@Tag(name = "Model", description = "Fraud scorer status and explainability")
public class ModelController {

    private final FraudScorer fraudScorer;

    public ModelController(FraudScorer fraudScorer) {
        this.fraudScorer = fraudScorer;
    }

    @Operation(summary = "Get scorer status",
            description = "Whether the random forest is trained, its size, training sample count, training accuracy " +
                    "and per-feature importance (mean impurity decrease).")
    @GetMapping
    public ResponseEntity<ModelStatus> getStatus() {
        return ResponseEntity.ok(fraudScorer.getStatus());
    }
}
