package com.example.reference_oracle.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI referenceOracleOpenAPI(OracleProperties properties) {
        String relayAccess = properties.getRelayers().isEmpty()
                ? "Any sender may relay."
                : "Relaying is limited to " + properties.getRelayers().size() + " configured relayer(s) identified by the X-Relayer header.";
        return new OpenAPI()
                .info(new Info()
                        .title("Reference Oracle API")
                        .description("Relayers publish batched u64 rates; consumers query cross-rates scaled by 1e18. "
                                + "USD is the fixed anchor at 1e9 and is never stored. " + relayAccess)
                        .version("1.0"))
                .addTagsItem(new Tag()
                        .name("Reference Oracle API")
                        .description("Relay rate batches, read stored refs, compute cross-rates. "
                                + "Numeric results are decimal strings."));
    }
}
