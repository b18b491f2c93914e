package com.di.bqindexer;

import com.di.bqindexer.config.IndexerProperties;
import com.di.bqindexer.indexer.IndexerRunnerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class BigQueryIndexerApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(BigQueryIndexerApplication.class, args);
		// When run-on-startup is off the service waits for POST /api/indexer/runs.
		if (ctx.getBean(IndexerProperties.class).isRunOnStartup()) {
			int exitCode = runOnce(ctx.getBean(IndexerRunnerService.class));
			System.exit(SpringApplication.exit(ctx, () -> exitCode));
		}
	}

	static int runOnce(IndexerRunnerService runner) {
		try {
			runner.run();
			return 0;
		} catch (RuntimeException e) {
			log.error("[RUN] indexer run failed, exiting with status 1");
			return 1;
		}
	}
}
