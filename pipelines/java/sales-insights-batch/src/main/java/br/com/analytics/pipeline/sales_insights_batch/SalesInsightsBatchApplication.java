package br.com.analytics.pipeline.sales_insights_batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SalesInsightsBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesInsightsBatchApplication.class, args);
    }
}
