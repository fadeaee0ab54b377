package com.bank.p2pfraud.service;

import com.bank.p2pfraud.model.DeviceAssessment;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DeviceFingerprintServiceTest {

    private static final String IPHONE = "Mozilla/5.0 (iPhone; CPU iPhone OS 14_7_1 like Mac OS X) Mobile";

    private final DeviceFingerprintService service = new DeviceFingerprintService();

    @Test
    void assess_firstSightingIsNewDevice_repeatIsKnown() {
        DeviceAssessment first = service.assess("USR-1", IPHONE, "1170x2532", "America/New_York", "10.0.0.1");
        DeviceAssessment second = service.assess("USR-1", IPHONE, "1170x2532", "America/New_York", "10.0.0.1");

        assertThat(first.getRiskFactors()).containsExactly("New device");
        assertThat(first.getRiskScore()).isCloseTo(0.3, within(1e-9));
        assertThat(second.getRiskFactors()).isEmpty();
        assertThat(second.getFingerprint()).isEqualTo(first.getFingerprint());
        assertThat(service.knownDeviceCount("USR-1")).isEqualTo(1);
    }

    @Test
    void assess_devicesAreTrackedPerUser() {
        service.assess("USR-1", IPHONE, "1170x2532", "UTC", "10.0.0.1");

        DeviceAssessment other = service.assess("USR-2", IPHONE, "1170x2532", "UTC", "10.0.0.1");

        assertThat(other.getRiskFactors()).contains("New device");
    }

    @Test
    void assess_emulatorProfile_isCappedAtOne() {
        DeviceAssessment assessment = service.assess("USR-3", "HeadlessChrome", "800x600", "Unknown", "1.2.3.4");

        assertThat(assessment.getRiskFactors()).containsExactly(
                "New device", "Desktop device", "Unknown timezone", "Suspicious screen resolution");
        assertThat(assessment.getRiskScore()).isEqualTo(1.0);
    }
}
