package com.accountengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Account Engine.
 *
 * Account Engine models bank accounts as capability contracts (deposit-only and
 * deposit-and-withdraw) so that any account can stand in for another with the same
 * capability. On startup it runs a console demonstration of those contracts.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AccountEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountEngineApplication.class, args);
    }
}
