package io.b2mash.b2b.tenantcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TenantCoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(TenantCoreApplication.class, args);
  }
}
