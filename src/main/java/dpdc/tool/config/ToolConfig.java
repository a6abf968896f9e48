package dpdc.tool.config;

import java.time.Duration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;

import dpdc.tool.pipeline.PipelineOrchestrator;
import dpdc.tool.reconcile.DatasetReconciler;
import dpdc.tool.support.AtomicTableWriter;

/**
 * Tool service configuration.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(ToolProperties.class)
public class ToolConfig {

	@Bean
	public AtomicTableWriter atomicTableWriter() {
		return new AtomicTableWriter();
	}

	@Bean
	public DatasetReconciler datasetReconciler() {
		return new DatasetReconciler();
	}

	@Bean
	public PipelineOrchestrator pipelineOrchestrator(AtomicTableWriter writer) {
		return new PipelineOrchestrator(writer);
	}

	@Bean
	public ClientHttpRequestFactory clientHttpRequestFactory() {
		// @formatter:off
		return ClientHttpRequestFactories.get(ClientHttpRequestFactorySettings.DEFAULTS
				.withConnectTimeout(Duration.ofSeconds(30))
				.withReadTimeout(Duration.ofMinutes(2)));
		// @formatter:on
	}

}
