package com.filerepo.extraction.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProperties(
	@NotNull @Min(1) @Max(100) Integer defaultK,
	@NotNull @Min(1) @Max(100) Integer maxK,
	@NotNull @Min(1) Integer minQueryLength,
	@NotNull @Min(1) Integer maxQueryLength
) {}
