package io.b2mash.b2b.vatledger.aggregator;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * VAT aggregator settings.
 *
 * @param mode "database" sums the local {@code vat_records} table, "http" calls a remote service
 * @param baseUrl base URL of the remote aggregator (http mode only)
 * @param connectTimeout connect timeout for the remote aggregator
 * @param readTimeout read timeout for the remote aggregator, and query timeout in database mode
 */
@ConfigurationProperties(prefix = "vat.aggregator")
public record AggregatorProperties(
    @DefaultValue("database") String mode,
    String baseUrl,
    @DefaultValue("2s") Duration connectTimeout,
    @DefaultValue("5s") Duration readTimeout) {}
