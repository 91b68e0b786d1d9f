package io.b2mash.b2b.vatledger.aggregator;

import io.b2mash.b2b.vatledger.exception.AggregatorUnavailableException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Remote aggregator adapter: {@code GET /clients/{clientId}/vat-totals?from=&to=} returning
 * {@code {"outputVat": .., "inputVat": ..}}. Any transport failure, timeout or non-2xx status is
 * reported as {@link AggregatorUnavailableException}; the adapter never retries.
 */
public class HttpVatAggregator implements VatAggregator {

  private static final Logger log = LoggerFactory.getLogger(HttpVatAggregator.class);

  private final RestClient restClient;

  public HttpVatAggregator(RestClient restClient) {
    this.restClient = restClient;
  }

  record TotalsPayload(BigDecimal outputVat, BigDecimal inputVat) {}

  @Override
  public String aggregatorId() {
    return "http";
  }

  @Override
  public VatTotals getTotals(UUID clientId, LocalDate from, LocalDate to) {
    TotalsPayload payload;
    try {
      payload =
          restClient
              .get()
              .uri(
                  uri ->
                      uri.path("/clients/{clientId}/vat-totals")
                          .queryParam("from", from.toString())
                          .queryParam("to", to.toString())
                          .build(clientId))
              .retrieve()
              .body(TotalsPayload.class);
    } catch (RestClientResponseException e) {
      log.warn(
          "VAT aggregator returned {} for client {} ({} to {})",
          e.getStatusCode().value(),
          clientId,
          from,
          to);
      throw new AggregatorUnavailableException(
          "VAT aggregator responded with status " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      log.warn("VAT aggregator call failed for client {}: {}", clientId, e.getMessage());
      throw new AggregatorUnavailableException("VAT aggregator could not be reached", e);
    }

    if (payload == null) {
      throw new AggregatorUnavailableException("VAT aggregator returned an empty response");
    }
    return new VatTotals(payload.outputVat(), payload.inputVat());
  }
}
