package io.b2mash.b2b.vatledger.vatperiod;

import io.b2mash.b2b.vatledger.client.Client;
import io.b2mash.b2b.vatledger.client.ClientRepository;
import io.b2mash.b2b.vatledger.vatperiod.dto.CalculateVatPeriodRequest;
import io.b2mash.b2b.vatledger.vatperiod.dto.SetCreditRequest;
import io.b2mash.b2b.vatledger.vatperiod.dto.VatPeriodResultResponse;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Maps HTTP requests onto {@link VatPeriodLedger} and enriches results with client details. */
@Service
public class VatPeriodService {

  private final VatPeriodLedger ledger;
  private final ClientRepository clientRepository;

  public VatPeriodService(VatPeriodLedger ledger, ClientRepository clientRepository) {
    this.ledger = ledger;
    this.clientRepository = clientRepository;
  }

  @Transactional
  public VatPeriodResultResponse calculate(CalculateVatPeriodRequest request) {
    var key =
        PeriodKey.of(request.clientId(), request.periodType(), request.year(), request.period());
    var entry = ledger.calculateForRequest(key, request.recalculateRequested());
    return toResponse(entry.result(), entry.created());
  }

  @Transactional
  public VatPeriodResultResponse calculate(UUID id, boolean fetchTotals) {
    return toResponse(ledger.calculate(id, fetchTotals), false);
  }

  @Transactional
  public VatPeriodResultResponse setCredit(UUID id, SetCreditRequest request) {
    return toResponse(ledger.setCredit(id, request.previousCredit(), request.forced()), false);
  }

  @Transactional
  public VatPeriodResultResponse lock(UUID id) {
    return toResponse(ledger.lock(id), false);
  }

  @Transactional
  public VatPeriodResultResponse unlock(UUID id) {
    return toResponse(ledger.unlock(id), false);
  }

  @Transactional(readOnly = true)
  public VatPeriodResultResponse get(UUID id) {
    return toResponse(ledger.get(id), false);
  }

  @Transactional(readOnly = true)
  public List<VatPeriodResultResponse> list(UUID clientId, PeriodType periodType, Integer year) {
    var results = ledger.list(clientId, periodType, year);
    Map<UUID, Client> clients =
        clientRepository.findAllById(results.stream().map(VatPeriodResult::getClientId).toList())
            .stream()
            .collect(Collectors.toMap(Client::getId, Function.identity()));
    return results.stream()
        .map(r -> VatPeriodResultResponse.from(r, clients.get(r.getClientId()), false))
        .toList();
  }

  private VatPeriodResultResponse toResponse(VatPeriodResult result, boolean created) {
    Client client = clientRepository.findById(result.getClientId()).orElse(null);
    return VatPeriodResultResponse.from(result, client, created);
  }
}
