package io.b2mash.b2b.vatledger.vatperiod;

import io.b2mash.b2b.vatledger.vatperiod.dto.CalculateVatPeriodRequest;
import io.b2mash.b2b.vatledger.vatperiod.dto.SetCreditRequest;
import io.b2mash.b2b.vatledger.vatperiod.dto.VatPeriodResultResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/vat-periods")
public class VatPeriodController {

  private final VatPeriodService vatPeriodService;

  public VatPeriodController(VatPeriodService vatPeriodService) {
    this.vatPeriodService = vatPeriodService;
  }

  /** Returns 201 when the period record was created by this call, 200 otherwise. */
  @PostMapping("/calculate")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<VatPeriodResultResponse> calculate(
      @Valid @RequestBody CalculateVatPeriodRequest request) {
    var response = vatPeriodService.calculate(request);
    if (response.created()) {
      return ResponseEntity.created(URI.create("/api/vat-periods/" + response.id()))
          .body(response);
    }
    return ResponseEntity.ok(response);
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<List<VatPeriodResultResponse>> list(
      @RequestParam UUID clientId,
      @RequestParam(required = false) PeriodType periodType,
      @RequestParam(required = false) Integer year) {
    return ResponseEntity.ok(vatPeriodService.list(clientId, periodType, year));
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<VatPeriodResultResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(vatPeriodService.get(id));
  }

  @PostMapping("/{id}/calculate")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<VatPeriodResultResponse> recalculate(
      @PathVariable UUID id, @RequestParam(defaultValue = "true") boolean fetchTotals) {
    return ResponseEntity.ok(vatPeriodService.calculate(id, fetchTotals));
  }

  @PostMapping("/{id}/credit")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<VatPeriodResultResponse> setCredit(
      @PathVariable UUID id, @Valid @RequestBody SetCreditRequest request) {
    return ResponseEntity.ok(vatPeriodService.setCredit(id, request));
  }

  @PostMapping("/{id}/lock")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<VatPeriodResultResponse> lock(@PathVariable UUID id) {
    return ResponseEntity.ok(vatPeriodService.lock(id));
  }

  @PostMapping("/{id}/unlock")
  @PreAuthorize("hasAnyRole('ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<VatPeriodResultResponse> unlock(@PathVariable UUID id) {
    return ResponseEntity.ok(vatPeriodService.unlock(id));
  }
}
