package com.commerce.diagnostics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI alertDiagnosticsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Alert Diagnostics API")
                        .version("1.0.0")
                        .description(
                                "Workflow-driven root cause analysis for metric regression alerts.\n\n" +
                                "**Run Pipeline:**\n" +
                                "1. Store a workflow graph via `POST /workflows` (validated, versioned per brand)\n" +
                                "2. Trigger it with an alert via `POST /workflows/run`\n" +
                                "3. The engine walks the graph node by node: validation, metric compare, " +
                                "branching, dimension breakdown, drill-down, confidence, insight\n" +
                                "4. The run ends as **success** (insight), **suppressed**, **deferred** or **error**\n\n" +
                                "**Node Types:** `validation`, `metric_compare`, `branch`, " +
                                "`recursive_dimension_breakdown`, `drill_down`, `composite`, `confidence`, " +
                                "`insight`, `suppression`, `defer`\n\n" +
                                "**Window tokens:** `start|end`, ISO instant, `prev_day_same_hour`, " +
                                "`prev_week_same_hour`, `prev_24_hours`, `avg_prev_N_days_same_hour`")
                        .contact(new Contact().name("Diagnostics Team")));
    }
}
