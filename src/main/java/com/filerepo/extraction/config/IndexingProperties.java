package com.filerepo.extraction.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.indexing")
public record IndexingProperties(
	@NotNull @Min(1) Long deadlineSeconds,
	@NotNull Boolean retainBlankPages,
	@NotNull @Min(1) Integer staleThresholdMinutes
) {
	public Duration deadline() {
		return Duration.ofSeconds(deadlineSeconds);
	}

	// a live run must never look abandoned to the maintenance worker
	@AssertTrue(message = "deadline-seconds must be shorter than stale-threshold-minutes")
	public boolean isDeadlineWithinStaleThreshold() {
		if (deadlineSeconds == null || staleThresholdMinutes == null) {
			return true;
		}
		return deadlineSeconds < staleThresholdMinutes * 60L;
	}
}
