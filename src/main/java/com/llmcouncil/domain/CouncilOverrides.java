package com.llmcouncil.domain;

import java.util.List;

/**
 * Per-conversation council settings. {@code null} fields inherit the global configuration.
 */
public record CouncilOverrides(List<String> councilModels, String chairmanModel, Boolean webSearchEnabled) {

    public static final CouncilOverrides NONE = new CouncilOverrides(null, null, null);

    public CouncilOverrides {
        councilModels = councilModels == null ? null : List.copyOf(councilModels);
    }
}
