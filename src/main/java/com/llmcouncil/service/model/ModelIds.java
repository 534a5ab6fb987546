package com.llmcouncil.service.model;

/**
 * Model identifier helpers.
 */
public final class ModelIds {

    /** Suffix selecting a model's web-search variant. */
    public static final String ONLINE_SUFFIX = ":online";

    private ModelIds() {
    }

    /**
     * Returns the web-search variant of {@code model}; ids that already carry the suffix are
     * returned unchanged.
     */
    public static String onlineVariant(String model) {
        if (model == null || model.endsWith(ONLINE_SUFFIX)) {
            return model;
        }
        return model + ONLINE_SUFFIX;
    }

    public static String effectiveModel(String model, boolean webSearch) {
        return webSearch ? onlineVariant(model) : model;
    }
}
