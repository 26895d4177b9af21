package org.learningjava.embbench.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    // one sampler per sweep point; the second thread only covers a loop that missed its stop deadline
    @Bean(name = "powerSamplerExecutor")
    public ThreadPoolTaskExecutor powerSamplerExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(2);
        ex.setQueueCapacity(0);
        ex.setDaemon(true);
        ex.setThreadNamePrefix("power-sampler-");
        ex.initialize();
        return ex;
    }
}
