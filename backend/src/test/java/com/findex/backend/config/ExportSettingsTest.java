package com.findex.backend.config;

import com.findex.backend.model.FailurePolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportSettingsTest {

    @Test
    void propertiesDefaultsMatchDocumentedValues() {
        ExportSettings settings = new ExportProperties().toSettings();

        assertThat(settings.regionPrefix()).isEqualTo("us-");
        assertThat(settings.outputDir()).isEqualTo(Path.of("./exports"));
        assertThat(settings.pageSize()).isEqualTo(50);
        assertThat(settings.failurePolicy()).isEqualTo(FailurePolicy.ABORT);
        assertThat(settings.regionParallelism()).isEqualTo(1);
    }

    @Test
    void pageSizeAboveGetFindingsLimitIsRejected() {
        ExportProperties properties = new ExportProperties();
        properties.setPageSize(51);

        assertThatThrownBy(properties::toSettings)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("page-size");
    }

    @Test
    void awsDefaults() {
        AwsSettings settings = new AwsProperties().toSettings();

        assertThat(settings.discoveryRegion()).isEqualTo("us-east-1");
        assertThat(settings.endpointOverride()).isNull();
        assertThat(settings.callTimeout().toMillis()).isEqualTo(30_000);
        assertThat(settings.rateLimitPerSecond()).isEqualTo(10);
    }
}
