package com.voxagent.gateway;

import com.voxagent.agent.DefaultAgentOrchestrator;
import com.voxagent.agent.OrchestratorSettings;
import com.voxagent.agent.PromptBuilder;
import com.voxagent.agent.ProviderResponseGenerator;
import com.voxagent.agent.ResponseGenerator;
import com.voxagent.memory.EmbeddingService;
import com.voxagent.memory.LuceneDocumentStore;
import com.voxagent.observability.OrchestrationMetrics;
import com.voxagent.providers.ProviderFactory;
import com.voxagent.sessions.SessionRegistry;
import com.voxagent.sessions.SessionUsageTracker;
import com.voxagent.shared.config.AgentCatalogLoader;
import com.voxagent.shared.config.ConfigLoader;
import com.voxagent.shared.config.VoxAgentConfig;
import com.voxagent.tools.DefaultToolClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public VoxAgentConfig voxAgentConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public OrchestrationMetrics orchestrationMetrics() {
        return new OrchestrationMetrics();
    }

    @Bean
    public SessionUsageTracker sessionUsageTracker() {
        return new SessionUsageTracker();
    }

    /**
     * Shared I/O pool for tool and generation calls. Carries the session MDC to workers.
     * When saturated the submitting thread runs the call; tool timeouts are armed before
     * submission and still apply.
     */
    @Bean(name = "orchestrationExecutor")
    public ThreadPoolTaskExecutor orchestrationExecutor(VoxAgentConfig config) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.dispatch().workerThreads());
        executor.setMaxPoolSize(config.dispatch().workerThreads());
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("voxagent-io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(runnable -> {
            var context = MDC.getCopyOfContextMap();
            return () -> {
                var previous = MDC.getCopyOfContextMap();
                try {
                    if (context != null) MDC.setContextMap(context);
                    runnable.run();
                } finally {
                    MDC.clear();
                    if (previous != null) MDC.setContextMap(previous);
                }
            };
        });
        executor.initialize();
        return executor;
    }

    @Bean(destroyMethod = "close")
    public LuceneDocumentStore documentStore(VoxAgentConfig config, EmbeddingService embeddingService) throws IOException {
        log.info("Document index at {}", config.retrieval().indexPath());
        return new LuceneDocumentStore(embeddingService, config.retrieval().indexPath());
    }

    @Bean
    public EmbeddingService embeddingService(VoxAgentConfig config) {
        var retrieval = config.retrieval();
        return new EmbeddingService(retrieval.embeddingBaseUrl(), config.apiKey("openai"), retrieval.embeddingModel());
    }

    @Bean
    public ResponseGenerator responseGenerator(VoxAgentConfig config, ThreadPoolTaskExecutor orchestrationExecutor) {
        return new ProviderResponseGenerator(ProviderFactory.fromConfig(config), new PromptBuilder(), orchestrationExecutor);
    }

    @Bean(destroyMethod = "close")
    public SessionRegistry sessionRegistry(VoxAgentConfig config, ResponseGenerator generator,
                                           ThreadPoolTaskExecutor orchestrationExecutor,
                                           LuceneDocumentStore documentStore, EmbeddingService embeddingService,
                                           SessionUsageTracker tracker, OrchestrationMetrics metrics) {
        var settings = OrchestratorSettings.from(config);
        var agentsFile = Path.of(config.agentsFile());
        return new SessionRegistry(sessionId -> new DefaultAgentOrchestrator(
                sessionId,
                AgentCatalogLoader.load(agentsFile),
                new DefaultToolClients(config.tools(), config.apiKeys(), documentStore, embeddingService,
                        config.retrieval().embeddingCacheSize()),
                generator,
                orchestrationExecutor,
                settings,
                tracker,
                metrics));
    }
}
