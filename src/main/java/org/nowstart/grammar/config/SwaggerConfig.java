package org.nowstart.grammar.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final BuildProperties buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("grammar API")
                        .description("Bar-by-bar certified-state decision engine per instrument: bar ingestion, "
                                + "friction updates, flatten, halt acknowledgement, session reset, zone records, "
                                + "ledger and journal, positions, summaries and the locked doctrine. "
                                + "Doctrine and thresholds are read-only.")
                        .version(buildProperties.getVersion()));
    }
}
