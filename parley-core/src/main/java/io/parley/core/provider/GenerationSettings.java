package io.parley.core.provider;

public record GenerationSettings(String model, int maxTokens, double temperature) {
    public static final int DEFAULT_MAX_TOKENS = 1024;

    public GenerationSettings {
        model = model == null ? "" : model.trim();
        maxTokens = maxTokens <= 0 ? DEFAULT_MAX_TOKENS : maxTokens;
        temperature = temperature < 0 ? 0 : temperature;
    }

    /** Model name with any {@code provider/} routing prefix removed. */
    public String wireModel() {
        int slash = model.indexOf('/');
        return slash < 0 ? model : model.substring(slash + 1);
    }
}
