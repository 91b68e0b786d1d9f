package io.b2mash.b2b.vatledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Ledger-wide settings.
 *
 * @param retryAfterSeconds value of the {@code Retry-After} header sent with 503 responses when
 *     the VAT aggregator is unavailable
 */
@ConfigurationProperties(prefix = "vat.ledger")
public record VatLedgerProperties(@DefaultValue("30") int retryAfterSeconds) {}
