package de.zeus.hems.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Copyright 2025 Guido Zeuner - https://tiny-tool.de
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Infrastructure beans of the simulation: its timer thread, the weather request pool,
 * the HTTP client, the clock and the random source.
 */
@Configuration
public class SimulationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Random simulationRandom(SimulationProperties properties) {
        Long seed = properties.getRandomSeed();
        return seed != null ? new Random(seed) : new Random();
    }

    @Bean
    public ThreadPoolTaskScheduler simulationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // a single timer thread keeps cycles strictly sequential
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("hems-simulation-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor weatherExecutor(SimulationProperties properties) {
        int poolSize = Math.max(1, properties.getWeatherBatchSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("hems-weather-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.setThreadFactory(r -> {
            Thread thread = new Thread(r);
            thread.setDaemon(true);
            thread.setName("hems-weather-" + thread.getId());
            return thread;
        });
        return executor;
    }

    @Bean
    public RestTemplate weatherRestTemplate(RestTemplateBuilder builder, WeatherProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
