package fr.lapetina.batchinference.domain.model;

import java.util.List;

/**
 * Generation settings carried alongside a prompt.
 * Immutable; null fields mean "use the backend default".
 */
public record InferenceParameters(
        Double temperature,
        Integer maxTokens,
        Double topP,
        Integer topK,
        Double repetitionPenalty,
        List<String> stopSequences
) {
    private static final InferenceParameters DEFAULTS = new InferenceParameters(
            0.7, 512, 0.9, null, 1.1, List.of()
    );

    public InferenceParameters {
        stopSequences = stopSequences != null ? List.copyOf(stopSequences) : List.of();
    }

    public static InferenceParameters defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Double temperature = DEFAULTS.temperature();
        private Integer maxTokens = DEFAULTS.maxTokens();
        private Double topP = DEFAULTS.topP();
        private Integer topK;
        private Double repetitionPenalty = DEFAULTS.repetitionPenalty();
        private List<String> stopSequences = List.of();

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        public Builder repetitionPenalty(Double repetitionPenalty) {
            this.repetitionPenalty = repetitionPenalty;
            return this;
        }

        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences;
            return this;
        }

        public InferenceParameters build() {
            return new InferenceParameters(
                    temperature, maxTokens, topP, topK, repetitionPenalty, stopSequences
            );
        }
    }
}
