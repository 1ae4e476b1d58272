package com.quackhouse.runtime;

import com.quackhouse.support.TestBase;
import com.quackhouse.support.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Hardware Profile")
public class HardwareProfileTest extends TestBase {

    private static final long GB = 1024L * 1024 * 1024;

    @Test
    @DisplayName("Small host is limited by memory")
    void smallHost() {
        HardwareProfile profile = new HardwareProfile(4, 10 * GB);

        assertThat(profile.recommendedThreadCount()).isEqualTo(4);
        assertThat(profile.recommendedMemoryLimit()).isEqualTo("8GB");
        assertThat(profile.recommendedPoolSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("Large host is capped by thread count")
    void largeHost() {
        HardwareProfile profile = new HardwareProfile(64, 1024 * GB);

        assertThat(profile.recommendedThreadCount()).isEqualTo(16);
        assertThat(profile.recommendedMemoryLimit()).isEqualTo("64GB");
        assertThat(profile.recommendedPoolSize()).isEqualTo(8);
    }

    @Test
    @DisplayName("Byte counts format with the largest whole unit")
    void formatBytes() {
        assertThat(HardwareProfile.formatBytes(3 * GB)).isEqualTo("3GB");
        assertThat(HardwareProfile.formatBytes(512L * 1024 * 1024)).isEqualTo("512MB");
        assertThat(HardwareProfile.formatBytes(2048)).isEqualTo("2KB");
        assertThat(HardwareProfile.formatBytes(10)).isEqualTo("10B");
    }

    @Test
    @DisplayName("Detection finds at least one core")
    void detect() {
        assertThat(HardwareProfile.detect().cpuCores()).isPositive();
    }
}
