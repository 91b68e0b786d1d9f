package io.b2mash.b2b.vatledger.client;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Read-only view of a client maintained by the client registry. The ledger only uses it to reject
 * unknown clients and to enrich responses with the display name and tax id.
 */
@Entity
@Table(name = "clients")
public class Client {

  @Id private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "tax_id", length = 20)
  private String taxId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Client() {}

  public Client(UUID id, String name, String taxId) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.taxId = taxId;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getTaxId() {
    return taxId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
