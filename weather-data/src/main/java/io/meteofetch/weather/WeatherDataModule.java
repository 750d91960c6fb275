package io.meteofetch.weather;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.meteofetch.budget.QuotaTracker;
import io.meteofetch.config.EngineConfig;
import io.meteofetch.core.ProviderClient;
import io.meteofetch.metrics.Metrics;
import io.meteofetch.runtime.AcquisitionEngine;
import io.meteofetch.runtime.BatchPlanner;
import io.meteofetch.runtime.FetchCoordinator;
import io.meteofetch.runtime.ProviderRegistry;
import io.meteofetch.runtime.ResultMerger;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

/**
 * Wires the two weather providers into an {@link AcquisitionEngine}. Open-Meteo is registered first so that
 * {@code auto} prefers the free provider unless a default order is configured.
 */
public class WeatherDataModule extends AbstractModule {
    private final WeatherDataConfig config;

    public WeatherDataModule(WeatherDataConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(WeatherDataConfig.class).toInstance(config);
        bind(EngineConfig.class).toInstance(config.engine());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton HttpClient httpClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Provides @Singleton QuotaTracker quotaTracker() {
        return new QuotaTracker(List.of(config.openMeteoProfile(), config.meteostatProfile()));
    }

    @Provides @Singleton OpenMeteoClient openMeteo(HttpClient http, ObjectMapper mapper, QuotaTracker quota) {
        return new OpenMeteoClient(config.openMeteoProfile(), config.openMeteoBaseUrl(), http, mapper, quota);
    }

    @Provides @Singleton MeteostatClient meteostat(HttpClient http, ObjectMapper mapper, QuotaTracker quota) {
        return new MeteostatClient(config.meteostatProfile(), config.meteostatBaseUrl(), config.meteostatApiKey(), http, mapper, quota);
    }

    @Provides @Singleton ProviderRegistry providerRegistry(OpenMeteoClient openMeteo, MeteostatClient meteostat) {
        return new ProviderRegistry(List.<ProviderClient>of(openMeteo, meteostat), config.engine().defaultProviderOrder());
    }

    @Provides @Singleton FetchCoordinator fetchCoordinator(ProviderRegistry registry, QuotaTracker quota, Metrics metrics) {
        return new FetchCoordinator(registry.clients(), quota, config.engine().maxInFlight(), metrics);
    }

    @Provides @Singleton AcquisitionEngine acquisitionEngine(ProviderRegistry registry, FetchCoordinator coordinator) {
        return new AcquisitionEngine(registry, new BatchPlanner(config.engine().maxRangeYears()), coordinator,
                new ResultMerger(), config.engine());
    }
}
