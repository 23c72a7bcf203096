package com.purchasingpower.policyflow.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GeminiProperties gemini = new GeminiProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private IdentifierProperties identifiers = new IdentifierProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private WorkflowProperties workflow = new WorkflowProperties();
}
