package com.cyberx.vpnpool.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI credentialApiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("VPN Credential Pool API")
                        .description("Imports pre-provisioned WireGuard configs, hands them out to participants " +
                                "and instances without ever issuing the same credential twice, and exports " +
                                "assigned configs with SHA256SUMS manifests.")
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development Server")
                ));
    }
}
