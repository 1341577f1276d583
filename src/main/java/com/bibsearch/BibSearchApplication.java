package com.bibsearch;

import com.bibsearch.core.QueryPipeline;
import com.bibsearch.exception.QueryParserException;
import com.bibsearch.query.expression.ParseResult;
import com.bibsearch.spring.EnableBibSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command line entry point: normalizes and segments each argument and logs
 * the resulting token sequence as JSON.
 * <pre>
 * java -jar bibsearch-query.jar "find a ellis and t quark" "ellis AND (muon OR kaon)"
 * </pre>
 */
@SpringBootApplication
@EnableBibSearch
public class BibSearchApplication {

    private static final Logger log = LoggerFactory.getLogger(BibSearchApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BibSearchApplication.class, args);
    }

    @Bean
    public CommandLineRunner segmentQueries(QueryPipeline pipeline) {
        return args -> {
            if (args.length == 0) {
                log.info("No queries given");
                return;
            }
            for (String query : args) {
                try {
                    ParseResult result = pipeline.process(query);
                    log.info("{} -> {}", query, result.toJson());
                } catch (QueryParserException e) {
                    log.error("Cannot parse query: {}", e.getMessage());
                }
            }
        };
    }
}
