package com.llmcouncil.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Global council configuration.
 *
 * <p>These are the defaults every conversation starts from. A conversation may override the
 * member list, the chairman and the web-search flag; the effective values are frozen into a
 * {@link com.llmcouncil.domain.CouncilSnapshot} at the start of each turn.
 */
@Validated
@ConfigurationProperties(prefix = "council")
public class CouncilProperties {

    /** Council members, in call-issue order. */
    @NotEmpty
    private final List<String> models;

    /** Model that synthesizes the final answer. */
    @NotBlank
    private final String chairmanModel;

    /** Request the web-search capability (":online" variant) for every call. */
    private final boolean webSearchEnabled;

    /** Number of most recent exchanges kept verbatim in model context. */
    @Min(1)
    private final int recentExchangeLimit;

    /** Upper bound on the conversation text handed to the summarizer. */
    @Min(100)
    private final int summaryMaxChars;

    /** Generated titles longer than this are cut and suffixed with "...". */
    @Min(10)
    private final int titleMaxLength;

    @ConstructorBinding
    public CouncilProperties(List<String> models, String chairmanModel, Boolean webSearchEnabled,
                             Integer recentExchangeLimit, Integer summaryMaxChars, Integer titleMaxLength) {
        this.models = models == null ? List.of() : List.copyOf(models);
        for (String m : this.models) {
            if (m == null || m.isBlank()) {
                throw new IllegalArgumentException("council.models entries must be non-empty");
            }
        }
        this.chairmanModel = chairmanModel;
        this.webSearchEnabled = webSearchEnabled != null && webSearchEnabled;
        this.recentExchangeLimit = recentExchangeLimit == null ? 5 : recentExchangeLimit;
        this.summaryMaxChars = summaryMaxChars == null ? 4000 : summaryMaxChars;
        this.titleMaxLength = titleMaxLength == null ? 50 : titleMaxLength;
    }

    public List<String> getModels() {
        return models;
    }

    public String getChairmanModel() {
        return chairmanModel;
    }

    public boolean isWebSearchEnabled() {
        return webSearchEnabled;
    }

    public int getRecentExchangeLimit() {
        return recentExchangeLimit;
    }

    public int getSummaryMaxChars() {
        return summaryMaxChars;
    }

    public int getTitleMaxLength() {
        return titleMaxLength;
    }
}
