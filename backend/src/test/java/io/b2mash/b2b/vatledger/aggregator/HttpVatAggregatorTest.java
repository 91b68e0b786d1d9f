package io.b2mash.b2b.vatledger.aggregator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.b2b.vatledger.exception.AggregatorUnavailableException;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class HttpVatAggregatorTest {

  private static final String BASE_URL = "http://aggregator.test";
  private static final UUID CLIENT_ID = UUID.fromString("7c4a1f0e-2b7d-4e55-9a61-0f3c2d8e9b10");
  private static final LocalDate FROM = LocalDate.of(2024, 1, 1);
  private static final LocalDate TO = LocalDate.of(2024, 3, 31);
  private static final String TOTALS_URL =
      BASE_URL + "/clients/" + CLIENT_ID + "/vat-totals?from=2024-01-01&to=2024-03-31";

  private MockRestServiceServer server;
  private HttpVatAggregator aggregator;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    aggregator = new HttpVatAggregator(builder.build());
  }

  @Test
  void getTotals_parsesTotals() {
    server
        .expect(requestTo(TOTALS_URL))
        .andExpect(method(HttpMethod.GET))
        .andRespond(
            withSuccess(
                "{\"outputVat\": 1000.00, \"inputVat\": 400.50}", MediaType.APPLICATION_JSON));

    var totals = aggregator.getTotals(CLIENT_ID, FROM, TO);

    assertThat(totals.outputVat()).isEqualByComparingTo(new BigDecimal("1000.00"));
    assertThat(totals.inputVat()).isEqualByComparingTo(new BigDecimal("400.50"));
    assertThat(totals.isValid()).isTrue();
    server.verify();
  }

  @Test
  void getTotals_missingFieldYieldsInvalidTotals() {
    server
        .expect(requestTo(TOTALS_URL))
        .andRespond(withSuccess("{\"outputVat\": 10.00}", MediaType.APPLICATION_JSON));

    var totals = aggregator.getTotals(CLIENT_ID, FROM, TO);

    assertThat(totals.inputVat()).isNull();
    assertThat(totals.isValid()).isFalse();
  }

  @Test
  void getTotals_serverErrorIsUnavailable() {
    server.expect(requestTo(TOTALS_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> aggregator.getTotals(CLIENT_ID, FROM, TO))
        .isInstanceOf(AggregatorUnavailableException.class)
        .hasMessageContaining("500");
  }

  @Test
  void getTotals_clientErrorIsUnavailable() {
    server.expect(requestTo(TOTALS_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> aggregator.getTotals(CLIENT_ID, FROM, TO))
        .isInstanceOf(AggregatorUnavailableException.class);
  }

  @Test
  void getTotals_timeoutIsUnavailable() {
    server
        .expect(requestTo(TOTALS_URL))
        .andRespond(withException(new SocketTimeoutException("Read timed out")));

    assertThatThrownBy(() -> aggregator.getTotals(CLIENT_ID, FROM, TO))
        .isInstanceOf(AggregatorUnavailableException.class)
        .hasMessageContaining("could not be reached");
  }

  @Test
  void getTotals_emptyBodyIsUnavailable() {
    server.expect(requestTo(TOTALS_URL)).andRespond(withSuccess());

    assertThatThrownBy(() -> aggregator.getTotals(CLIENT_ID, FROM, TO))
        .isInstanceOf(AggregatorUnavailableException.class)
        .hasMessageContaining("empty");
  }
}
