package com.jasmin.abuseguard.detectors.patterndetector;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "abuse-guard.pattern")
public class PatternDetectorProperties {

    private boolean enabled = true;

    /* ------------------------- Burst ------------------------- */

    /** Events from one subject within {@link #burstWindow} that count as a burst. */
    @Min(1)
    private int burstThreshold = 5;

    @NotNull
    @DurationMin(seconds = 1)
    private Duration burstWindow = Duration.ofMinutes(5);

    @NotNull
    @DurationMin(seconds = 1)
    private Duration burstBlockDuration = Duration.ofHours(1);

    /* ------------------------- Repeated failures ------------------------- */

    /** Failure events for one account within {@link #repeatedFailureWindow} that trigger a block. */
    @Min(1)
    private int repeatedFailureThreshold = 3;

    @NotNull
    @DurationMin(seconds = 1)
    private Duration repeatedFailureWindow = Duration.ofMinutes(10);

    @NotNull
    @DurationMin(seconds = 1)
    private Duration repeatedFailureBlockDuration = Duration.ofMinutes(30);

    /* ------------------------- Buffer bounds ------------------------- */

    /** Events kept per subject; the oldest are overwritten first. */
    @Min(1)
    private int bufferCapacityPerSubject = 64;

    /** Tracked subjects above which stale subjects are evicted. */
    @Min(1)
    private int maxSubjects = 50_000;

    @AssertTrue(message = "buffer-capacity-per-subject must hold at least one full burst and repeated-failure run")
    public boolean isBufferLargeEnough() {
        return bufferCapacityPerSubject >= Math.max(burstThreshold, repeatedFailureThreshold);
    }

    /** How long the buffer needs to remember an event. */
    public Duration retention() {
        return burstWindow.compareTo(repeatedFailureWindow) >= 0 ? burstWindow : repeatedFailureWindow;
    }
}
