package com.findex.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final ExportSettings exportSettings;
    private final AwsSettings awsSettings;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        log.info("Findings export API listening on port {} (base URL: http://localhost:{}{})",
                port, port, contextPath);
        log.info("Exports go to {} (region prefix '{}', page size {}, policy {}, region parallelism {})",
                exportSettings.outputDir().toAbsolutePath(), exportSettings.regionPrefix(),
                exportSettings.pageSize(), exportSettings.failurePolicy(), exportSettings.regionParallelism());
        if (awsSettings.endpointOverride() != null) {
            log.warn("AWS endpoint override active: {}", awsSettings.endpointOverride());
        }
    }
}
