package com.llmcouncil.service.health;

import com.llmcouncil.config.properties.CouncilProperties;
import com.llmcouncil.config.properties.OpenRouterProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the council can deliberate at all.
 *
 * <ul>
 *   <li>UP: API key present and at least one council member and a chairman configured</li>
 *   <li>DOWN: any of these missing; every model call would fail</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health. No model is called; reachability of individual models shows
 * up in per-call failure metrics instead.
 */
@Component
public class CouncilHealthIndicator implements HealthIndicator {

    private final CouncilProperties council;
    private final OpenRouterProperties openRouter;

    public CouncilHealthIndicator(CouncilProperties council, OpenRouterProperties openRouter) {
        this.council = council;
        this.openRouter = openRouter;
    }

    @Override
    public Health health() {
        boolean hasKey = openRouter.hasApiKey();
        boolean hasMembers = !council.getModels().isEmpty();
        boolean hasChairman = council.getChairmanModel() != null && !council.getChairmanModel().isBlank();

        Health.Builder builder = hasKey && hasMembers && hasChairman ? Health.up() : Health.down();
        builder.withDetail("apiKey", hasKey ? "configured" : "missing")
                .withDetail("councilMembers", council.getModels().size())
                .withDetail("chairman", hasChairman ? council.getChairmanModel() : "missing")
                .withDetail("webSearch", council.isWebSearchEnabled());
        if (!hasKey) {
            builder.withDetail("reason", "council.openrouter.api-key is not set");
        } else if (!hasMembers || !hasChairman) {
            builder.withDetail("reason", "council.models and council.chairman-model must be configured");
        }
        return builder.build();
    }
}
