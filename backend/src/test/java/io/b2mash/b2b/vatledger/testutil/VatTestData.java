package io.b2mash.b2b.vatledger.testutil;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;

/** Seeds clients and VAT rows directly, and builds role-scoped JWTs for MockMvc calls. */
public final class VatTestData {

  public static final int SALE = 1;
  public static final int PURCHASE = 2;

  private VatTestData() {}

  public static UUID createClient(JdbcTemplate jdbc, String name, String taxId) {
    UUID id = UUID.randomUUID();
    jdbc.update("INSERT INTO clients (id, name, tax_id) VALUES (?, ?, ?)", id, name, taxId);
    return id;
  }

  public static void addVatRecord(
      JdbcTemplate jdbc, UUID clientId, int recType, LocalDate issueDate, String vatAmount) {
    addVatRecord(jdbc, clientId, recType, issueDate, vatAmount, false);
  }

  public static void addVatRecord(
      JdbcTemplate jdbc,
      UUID clientId,
      int recType,
      LocalDate issueDate,
      String vatAmount,
      boolean cancelled) {
    jdbc.update(
        """
        INSERT INTO vat_records (id, client_id, rec_type, issue_date, vat_amount, is_cancelled)
        VALUES (?, ?, ?, ?, ?, ?)
        """,
        UUID.randomUUID(),
        clientId,
        recType,
        issueDate,
        new BigDecimal(vatAmount),
        cancelled);
  }

  public static JwtRequestPostProcessor memberJwt() {
    return roleJwt("user_vat_member", "member", "ROLE_ORG_MEMBER");
  }

  public static JwtRequestPostProcessor adminJwt() {
    return roleJwt("user_vat_admin", "admin", "ROLE_ORG_ADMIN");
  }

  public static JwtRequestPostProcessor ownerJwt() {
    return roleJwt("user_vat_owner", "owner", "ROLE_ORG_OWNER");
  }

  private static JwtRequestPostProcessor roleJwt(String subject, String role, String authority) {
    return SecurityMockMvcRequestPostProcessors.jwt()
        .jwt(
            j ->
                j.subject(subject)
                    .claim("o", Map.of("id", "org_vat_test", "rol", role)))
        .authorities(List.of(new SimpleGrantedAuthority(authority)));
  }
}
