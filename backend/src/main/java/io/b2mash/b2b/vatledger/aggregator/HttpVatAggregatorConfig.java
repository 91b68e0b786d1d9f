package io.b2mash.b2b.vatledger.aggregator;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "vat.aggregator.mode", havingValue = "http")
public class HttpVatAggregatorConfig {

  @Bean
  public HttpVatAggregator httpVatAggregator(AggregatorProperties properties) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException(
          "vat.aggregator.base-url is required when vat.aggregator.mode=http");
    }
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());

    var restClient =
        RestClient.builder().baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
    return new HttpVatAggregator(restClient);
  }
}
