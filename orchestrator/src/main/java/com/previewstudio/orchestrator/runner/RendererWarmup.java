package com.previewstudio.orchestrator.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Startup check of the Docker daemon, then a background pull of the
 * renderer image so the first preview does not wait for it.
 *
 * A missing daemon is logged, not fatal: jobs fail individually until
 * it becomes reachable.
 */
@Component
public class RendererWarmup implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RendererWarmup.class);

    private final ContainerRunner runner;

    public RendererWarmup(ContainerRunner runner) {
        this.runner = runner;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!runner.isDockerAvailable()) {
            log.warn("Docker daemon is not reachable; preview jobs will fail until it is");
            return;
        }
        Thread pull = new Thread(runner::prePullImage, "renderer-prepull");
        pull.setDaemon(true);
        pull.start();
    }
}
