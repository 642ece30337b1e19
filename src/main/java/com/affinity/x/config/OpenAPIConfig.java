package com.affinity.x.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;


@Configuration
public class OpenAPIConfig {
    private static final String VIEWER_SCHEME = "ViewerId";

    /**
     * Documents the viewer header every endpoint requires.
     *
     * @return the open api
     */
    @Bean
    public OpenAPI customOpenAPI(@Value("${matching.auth.viewer-header:X-Viewer-Id}") String viewerHeader) {
        return new OpenAPI()
                .info(new Info().title("affinity-x").description("Compatibility scoring and potential matches").version("v1"))
                .addSecurityItem(new SecurityRequirement().addList(VIEWER_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(VIEWER_SCHEME,
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name(viewerHeader)
                                        .description("Authenticated viewer id set by the gateway")));
    }
}
