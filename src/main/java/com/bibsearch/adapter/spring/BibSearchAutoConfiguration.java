package com.bibsearch.adapter.spring;

import com.bibsearch.config.ConfigLoader;
import com.bibsearch.config.SearchSyntaxConfig;
import com.bibsearch.core.QueryPipeline;
import com.bibsearch.query.expression.ParenthesisedQueryParser;
import com.bibsearch.query.legacy.LegacySyntaxConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for query normalization.
 */
@Configuration
@ConditionalOnProperty(prefix = "bibsearch", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(BibSearchProperties.class)
public class BibSearchAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BibSearchAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SearchSyntaxConfig searchSyntaxConfig(BibSearchProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public LegacySyntaxConverter legacySyntaxConverter(SearchSyntaxConfig config) {
        log.info("Creating LegacySyntaxConverter for site: {}", config.name());
        return new LegacySyntaxConverter(config.conversionOptions());
    }

    @Bean
    @ConditionalOnMissingBean
    public ParenthesisedQueryParser parenthesisedQueryParser() {
        return new ParenthesisedQueryParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryPipeline queryPipeline(LegacySyntaxConverter converter, ParenthesisedQueryParser parser) {
        return new QueryPipeline(converter, parser);
    }
}
