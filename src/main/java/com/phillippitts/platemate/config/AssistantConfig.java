package com.phillippitts.platemate.config;

import com.phillippitts.platemate.config.properties.GeminiProperties;
import com.phillippitts.platemate.config.properties.LocationProperties;
import com.phillippitts.platemate.config.properties.PersistenceProperties;
import com.phillippitts.platemate.service.conversation.GenerativeChatApi;
import com.phillippitts.platemate.service.conversation.gemini.GeminiChatApi;
import com.phillippitts.platemate.service.location.LocationProvider;
import com.phillippitts.platemate.service.location.ReverseGeocodeProvider;
import com.phillippitts.platemate.service.location.impl.IpGeolocationLocationProvider;
import com.phillippitts.platemate.service.location.impl.NominatimReverseGeocodeProvider;
import com.phillippitts.platemate.service.location.impl.StaticLocationProvider;
import com.phillippitts.platemate.service.persistence.FilePersistenceStore;
import com.phillippitts.platemate.service.persistence.PersistenceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Wires the external collaborators of the assistant: chat API, location sources, persistence,
 * and the clock and random source used by the core.
 */
@Configuration
public class AssistantConfig {

    private static final Logger LOG = LogManager.getLogger(AssistantConfig.class);

    private static final Duration GEO_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration GEO_READ_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Random source for synthesized restaurant fields. */
    @Bean
    @ConditionalOnMissingBean
    public Random extractionRandom() {
        return new Random();
    }

    @Bean
    public GenerativeChatApi generativeChatApi(RestClient.Builder builder, GeminiProperties props) {
        if (!props.hasApiKey()) {
            LOG.warn("GEMINI_API_KEY is not set; connecting to the assistant will fail");
        }
        RestClient client = builder.clone()
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory(props.connectTimeout(), props.readTimeout()))
                .build();
        return new GeminiChatApi(client, props);
    }

    @Bean
    public LocationProvider locationProvider(LocationProperties props,
                                             RestClient.Builder builder,
                                             @Qualifier("locationScheduler") ThreadPoolTaskScheduler scheduler) {
        return switch (props.getProvider()) {
            case STATIC -> new StaticLocationProvider(props.getStaticLatitude(), props.getStaticLongitude());
            case IP -> new IpGeolocationLocationProvider(geoClient(builder, props), props.getIpLookupUrl(),
                    scheduler, props.getUpdateInterval());
        };
    }

    @Bean
    public ReverseGeocodeProvider reverseGeocodeProvider(LocationProperties props,
                                                         RestClient.Builder builder,
                                                         @Qualifier("locationScheduler") ThreadPoolTaskScheduler scheduler) {
        return new NominatimReverseGeocodeProvider(geoClient(builder, props), props.getReverseGeocodeUrl(), scheduler);
    }

    @Bean
    public PersistenceStore persistenceStore(PersistenceProperties props) {
        return new FilePersistenceStore(Path.of(props.stateFile()));
    }

    private static RestClient geoClient(RestClient.Builder builder, LocationProperties props) {
        return builder.clone()
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .requestFactory(requestFactory(GEO_CONNECT_TIMEOUT, GEO_READ_TIMEOUT))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connect);
        factory.setReadTimeout(read);
        return factory;
    }
}
