package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.Settings;
import com.bank.p2pfraud.service.SettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify the live fraud policy")
public class ConfigController {

    private final SettingsService settingsService;

    public ConfigController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Operation(summary = "Get the fraud policy")
    @GetMapping
    public ResponseEntity<Settings> getConfiguration() {
        return ResponseEntity.ok(settingsService.getSettings());
    }

    @Operation(summary = "Replace the fraud policy",
            description = "Admin only. Takes effect on the next payment decision; no restart required.")
    @PutMapping
    public ResponseEntity<Settings> setConfiguration(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @RequestBody Settings settings) {
        return ResponseEntity.ok(settingsService.updateSettings(CallerContext.of(callerId, callerRole), settings));
    }
}
