package com.delta.extractor.service;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.model.ResourceDescriptor;
import com.delta.extractor.transfer.TransferCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Component
public class ExtractorCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ExtractorCliRunner.class);

    private final ExtractorProperties properties;
    private final TransferCoordinator coordinator;
    private final ConfigurableApplicationContext applicationContext;

    public ExtractorCliRunner(
        ExtractorProperties properties,
        TransferCoordinator coordinator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.coordinator = coordinator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ExtractorProperties.Cli cli = properties.getCli();
        if (!cli.isRun() && !cli.isResumeIncomplete()) {
            return;
        }

        Map<String, CompletableFuture<Path>> submitted = new LinkedHashMap<>();
        if (cli.isResumeIncomplete()) {
            submitted.putAll(coordinator.resumeIncompleteJobs());
        }
        if (cli.isRun()) {
            if (cli.getUrl() == null || cli.getUrl().isBlank()) {
                log.error("extractor.cli.url is required when extractor.cli.run=true");
            } else {
                String jobId = cli.getJobId() == null || cli.getJobId().isBlank() ? coordinator.newJobId() : cli.getJobId();
                String resourceId = cli.getResourceId() == null || cli.getResourceId().isBlank() ? jobId : cli.getResourceId();
                String target = cli.getTarget() == null || cli.getTarget().isBlank()
                    ? Path.of(properties.getTransfer().getOutputDir(), resourceId).toString()
                    : cli.getTarget();
                String variantId = cli.getVariantId() == null || cli.getVariantId().isBlank() ? null : cli.getVariantId();
                ResourceDescriptor descriptor = new ResourceDescriptor(resourceId, cli.getUrl(), null, variantId);
                submitted.put(jobId, coordinator.submit(jobId, descriptor, target));
            }
        }

        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<Path>> entry : submitted.entrySet()) {
            try {
                Path result = entry.getValue().join();
                log.info("Job {} finished: {}", entry.getKey(), result);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Job {} did not finish: {}", entry.getKey(), cause.getMessage());
                failed.add(entry.getKey());
            }
        }
        log.info("CLI run finished: {} job(s), {} failed {}", submitted.size(), failed.size(), failed);

        if (cli.isExitAfterRun()) {
            int exitStatus = failed.isEmpty() ? 0 : 1;
            int exitCode = SpringApplication.exit(applicationContext, () -> exitStatus);
            System.exit(exitCode);
        }
    }
}
