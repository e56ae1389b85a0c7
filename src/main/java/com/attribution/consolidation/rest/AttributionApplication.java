package com.attribution.consolidation.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Attribution Consolidation API",
                version = "1.0.0",
                description = "Consolidates blockchain address attributions from victim reports, threat " +
                        "intelligence feeds, VASP registries and on-chain analysis into one weighted " +
                        "verdict per address, with confidence levels and conflict flags.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class AttributionApplication extends Application {
}
