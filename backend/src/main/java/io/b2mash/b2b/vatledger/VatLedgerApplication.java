package io.b2mash.b2b.vatledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VatLedgerApplication {

  public static void main(String[] args) {
    SpringApplication.run(VatLedgerApplication.class, args);
  }
}
