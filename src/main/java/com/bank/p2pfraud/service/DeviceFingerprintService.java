package com.bank.p2pfraud.service;

import com.bank.p2pfraud.model.DeviceAssessment;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Display-only device risk. Keeps the fingerprints seen per user for the
 * lifetime of the process; the assessment is recorded on the transaction and
 * never feeds the score.
 */
@Service
public class DeviceFingerprintService {

    private static final Set<String> SUSPICIOUS_RESOLUTIONS = Set.of("800x600", "1024x768", "320x240");

    private final Map<String, Set<String>> knownDevices = new ConcurrentHashMap<>();

    public DeviceAssessment assess(String userId, String deviceSignature, String screenResolution,
                                   String timezone, String ipAddress) {
        String userAgent = deviceSignature != null ? deviceSignature : "";
        String fingerprint = fingerprint(userAgent, screenResolution, timezone, ipAddress);

        double risk = 0.0;
        List<String> factors = new ArrayList<>();

        Set<String> devices = knownDevices.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet());
        if (devices.add(fingerprint)) {
            risk += 0.3;
            factors.add("New device");
        }
        if (!userAgent.toLowerCase(Locale.ROOT).contains("mobile")) {
            risk += 0.1;
            factors.add("Desktop device");
        }
        if (timezone != null && timezone.toLowerCase(Locale.ROOT).contains("unknown")) {
            risk += 0.2;
            factors.add("Unknown timezone");
        }
        if (screenResolution != null && SUSPICIOUS_RESOLUTIONS.contains(screenResolution)) {
            risk += 0.4;
            factors.add("Suspicious screen resolution");
        }

        return DeviceAssessment.builder()
                .fingerprint(fingerprint)
                .riskScore(Math.min(risk, 1.0))
                .riskFactors(factors)
                .build();
    }

    public int knownDeviceCount(String userId) {
        Set<String> devices = knownDevices.get(userId);
        return devices != null ? devices.size() : 0;
    }

    private static String fingerprint(String userAgent, String screenResolution, String timezone, String ip) {
        String ipHash = sha256(ip != null ? ip : "").substring(0, 8);
        String material = String.join("|",
                userAgent,
                screenResolution != null ? screenResolution : "",
                timezone != null ? timezone : "",
                ipHash);
        return sha256(material);
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
