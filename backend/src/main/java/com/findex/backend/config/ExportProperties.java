package com.findex.backend.config;

import com.findex.backend.model.FailurePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "findex.export")
@Data
public class ExportProperties {

    private String regionPrefix = "us-";
    private String outputDir = "./exports";
    private int pageSize = 50;
    private FailurePolicy failurePolicy = FailurePolicy.ABORT;
    private int regionParallelism = 1;

    public ExportSettings toSettings() {
        return new ExportSettings(regionPrefix, Path.of(outputDir), pageSize, failurePolicy, regionParallelism);
    }
}
