package com.pie.engine;

/**
 * Raw engine answer: exit status, standard output (content on success) and diagnostic text.
 */
public record EngineResponse(int exitCode, String output, String diagnostic) {

    public EngineResponse {
        output = output != null ? output : "";
        diagnostic = diagnostic != null ? diagnostic : "";
    }

    public static EngineResponse success(String output) {
        return new EngineResponse(0, output, "");
    }

    public static EngineResponse failure(int exitCode, String diagnostic) {
        return new EngineResponse(exitCode, "", diagnostic);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
