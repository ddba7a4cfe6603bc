package com.enrichreview.backend.config;

import com.enrichreview.backend.pipeline.RestClientDocumentPairSource;
import com.enrichreview.engine.core.pipeline.DocumentPairSource;
import com.enrichreview.engine.core.pipeline.SampleDocumentPairSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class PairSourceConfig {

    @Bean
    @ConditionalOnProperty(name = "review.pair-source", havingValue = "http")
    public DocumentPairSource httpPairSource(ReviewProperties props, RestClient.Builder builder) {
        ReviewProperties.Pipeline pipeline = props.getPipeline();
        if (pipeline.getBaseUrl() == null || pipeline.getBaseUrl().isBlank()) {
            throw new IllegalStateException("review.pipeline.base-url is required when review.pair-source=http");
        }

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) pipeline.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) pipeline.getReadTimeout().toMillis());

        RestClient rest = builder
                .baseUrl(pipeline.getBaseUrl())
                .requestFactory(factory)
                .build();
        return new RestClientDocumentPairSource(rest);
    }

    // Canned headphones pair when no pipeline is wired up
    @Bean
    @ConditionalOnMissingBean(DocumentPairSource.class)
    public DocumentPairSource samplePairSource(ObjectMapper om) {
        return new SampleDocumentPairSource(om);
    }
}
