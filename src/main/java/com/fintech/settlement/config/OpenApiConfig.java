package com.fintech.settlement.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    private static final String TENANT_PARAMETER = "TenantId";

    @Bean
    public OpenAPI settlementEngineOpenAPI(SettlementProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Payment Settlement Engine API")
                        .description("Payment intents, provider webhooks, subscription renewals and dunning, "
                                + "the double-entry ledger and daily settlement reconciliation. "
                                + "All amounts are integer minor units of " + properties.getCurrency() + ".")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Payments Platform Team")
                                .email("payments@example.com")))
                .components(new Components()
                        .addParameters(TENANT_PARAMETER, new HeaderParameter()
                                .name("X-Tenant-ID")
                                .description("Tenant owning the payment, subscription or ledger account")
                                .required(true)
                                .schema(new StringSchema())))
                .tags(List.of(
                        new Tag().name("Webhooks").description("Always acknowledged with HTTP 200"),
                        new Tag().name("Ledger").description("Read-only; entries are never updated or deleted")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
