package org.learningjava.embbench.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.learningjava.embbench.application.port.EmbeddingClientFactory;
import org.learningjava.embbench.application.port.PowerMeterPort;
import org.learningjava.embbench.application.port.ResultStorePort;
import org.learningjava.embbench.application.port.ServerReadinessPort;
import org.learningjava.embbench.application.usecase.AggregateResultsUseCase;
import org.learningjava.embbench.application.usecase.RunSweepUseCase;
import org.learningjava.embbench.domain.service.dispatch.BoundedDispatcher;
import org.learningjava.embbench.domain.service.power.PowerSampler;
import org.learningjava.embbench.domain.service.sweep.SweepPointEvaluator;
import org.learningjava.embbench.domain.service.text.SyntheticTextGenerator;
import org.learningjava.embbench.infrastructure.adapter.out.fs.JsonFileResultStore;
import org.learningjava.embbench.infrastructure.adapter.out.openai.OpenAiEmbeddingClientFactory;
import org.learningjava.embbench.infrastructure.adapter.out.openai.OpenAiServerProbe;
import org.learningjava.embbench.infrastructure.adapter.out.power.NoopPowerMeter;
import org.learningjava.embbench.infrastructure.adapter.out.power.NvidiaSmiPowerMeter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    //objects with external dependencies
    @Bean
    EmbeddingClientFactory embeddingClients(OkHttpClient http, ObjectMapper om, BenchProperties props) {
        return new OpenAiEmbeddingClientFactory(http, om, props.getBaseUrl(),
                props.getRequestTimeout(), props.getConnectionHeadroom());
    }

    @Bean
    ServerReadinessPort serverReadiness(OkHttpClient http, BenchProperties props) {
        OkHttpClient probe = http.newBuilder()
                .callTimeout(Duration.ofSeconds(5))
                .build();
        return new OpenAiServerProbe(props.getBaseUrl(), probe, Duration.ofSeconds(1));
    }

    @Bean(destroyMethod = "close")
    PowerMeterPort powerMeter(BenchProperties props) {
        BenchProperties.Power power = props.getPower();
        if (!power.isEnabled()) return new NoopPowerMeter();
        return NvidiaSmiPowerMeter.open(power.getCommand(), power.getProbeTimeout());
    }

    @Bean
    ResultStorePort resultStore(ObjectMapper om) {
        return new JsonFileResultStore(om);
    }

    // domain services
    @Bean
    SyntheticTextGenerator syntheticTextGenerator(BenchProperties props) {
        return new SyntheticTextGenerator(props.getSeed());
    }

    @Bean
    PowerSampler powerSampler(PowerMeterPort meter,
                              @Qualifier("powerSamplerExecutor") ThreadPoolTaskExecutor executor,
                              BenchProperties props) {
        return new PowerSampler(meter, executor,
                props.getPower().getPollInterval(), props.getPower().getStopTimeout());
    }

    @Bean
    SweepPointEvaluator sweepPointEvaluator(SyntheticTextGenerator texts,
                                            EmbeddingClientFactory clients,
                                            BoundedDispatcher dispatcher,
                                            PowerSampler sampler) {
        return new SweepPointEvaluator(texts, clients, dispatcher, sampler);
    }

    // use cases
    @Bean
    RunSweepUseCase runSweep(SweepPointEvaluator evaluator, ResultStorePort store) {
        return new RunSweepUseCase(evaluator, store);
    }

    @Bean
    AggregateResultsUseCase aggregateResults(ResultStorePort store) {
        return new AggregateResultsUseCase(store);
    }
}
