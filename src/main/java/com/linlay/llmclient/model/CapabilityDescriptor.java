package com.linlay.llmclient.model;

public record CapabilityDescriptor(
        boolean stream,
        boolean imageInput,
        boolean audioInput,
        boolean videoInput,
        boolean tools,
        boolean structuredOutput,
        boolean parallelToolCalls
) {

    public static CapabilityDescriptor none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean stream;
        private boolean imageInput;
        private boolean audioInput;
        private boolean videoInput;
        private boolean tools;
        private boolean structuredOutput;
        private boolean parallelToolCalls;

        private Builder() {
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder imageInput(boolean imageInput) {
            this.imageInput = imageInput;
            return this;
        }

        public Builder audioInput(boolean audioInput) {
            this.audioInput = audioInput;
            return this;
        }

        public Builder videoInput(boolean videoInput) {
            this.videoInput = videoInput;
            return this;
        }

        public Builder tools(boolean tools) {
            this.tools = tools;
            return this;
        }

        public Builder structuredOutput(boolean structuredOutput) {
            this.structuredOutput = structuredOutput;
            return this;
        }

        public Builder parallelToolCalls(boolean parallelToolCalls) {
            this.parallelToolCalls = parallelToolCalls;
            return this;
        }

        public CapabilityDescriptor build() {
            return new CapabilityDescriptor(stream, imageInput, audioInput, videoInput, tools,
                    structuredOutput, parallelToolCalls);
        }
    }
}
