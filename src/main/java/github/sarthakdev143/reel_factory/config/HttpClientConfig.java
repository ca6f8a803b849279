package github.sarthakdev143.reel_factory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * One {@link RestClient} per outbound collaborator, all sharing the configured timeouts.
 */
@Configuration
@EnableConfigurationProperties(ReelFactoryProperties.class)
public class HttpClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean("scriptRestClient")
    RestClient scriptRestClient(RestClient.Builder builder, ReelFactoryProperties properties) {
        ReelFactoryProperties.Script script = properties.script();
        return withBearer(builder, script.apiKey())
                .baseUrl(script.baseUrl())
                .requestFactory(requestFactory(properties.http()))
                .build();
    }

    @Bean("speechRestClient")
    RestClient speechRestClient(RestClient.Builder builder, ReelFactoryProperties properties) {
        ReelFactoryProperties.Speech speech = properties.speech();
        return withBearer(builder, speech.apiKey())
                .baseUrl(speech.baseUrl())
                .requestFactory(requestFactory(properties.http()))
                .build();
    }

    @Bean("mediaSearchRestClient")
    RestClient mediaSearchRestClient(RestClient.Builder builder, ReelFactoryProperties properties) {
        return builder
                .baseUrl(properties.mediaSearch().baseUrl())
                .requestFactory(requestFactory(properties.http()))
                .build();
    }

    @Bean("downloadRestClient")
    RestClient downloadRestClient(RestClient.Builder builder, ReelFactoryProperties properties) {
        return builder
                .requestFactory(requestFactory(properties.http()))
                .build();
    }

    private RestClient.Builder withBearer(RestClient.Builder builder, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey.trim());
        }
        return builder;
    }

    private SimpleClientHttpRequestFactory requestFactory(ReelFactoryProperties.Http http) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(http.connectTimeout());
        factory.setReadTimeout(http.readTimeout());
        logger.debug(
                "Configured outbound HTTP timeouts connect={}ms read={}ms",
                http.connectTimeout().toMillis(),
                http.readTimeout().toMillis());
        return factory;
    }
}
