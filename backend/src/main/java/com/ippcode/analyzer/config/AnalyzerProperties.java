package com.ippcode.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "ippcode.analyzer")
@Validated
public record AnalyzerProperties(
    @NotBlank
    @DefaultValue(".IPPcode24")
    String header,

    @NotBlank
    @DefaultValue("IPPcode24")
    String language,

    @NotBlank
    @DefaultValue("#")
    String commentMarker,

    @Positive
    @DefaultValue("1000000")
    Integer maxSourceCodeLength
) {

    @ConstructorBinding
    public AnalyzerProperties {
    }

    public AnalyzerProperties() {
        this(
            ".IPPcode24",
            "IPPcode24",
            "#",
            1_000_000
        );
    }
}
