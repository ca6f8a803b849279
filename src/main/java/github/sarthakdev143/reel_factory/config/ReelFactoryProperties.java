package github.sarthakdev143.reel_factory.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the reel pipeline and the services it calls.
 *
 * <p>API keys may be blank. A blank key makes the matching collaborator fail fast, and the pipeline falls
 * back or skips as it does for any other failure of that collaborator.
 */
@ConfigurationProperties(prefix = "reel-factory")
@Validated
public record ReelFactoryProperties(
        @Valid @NotNull Storage storage,
        @Valid @NotNull Pipeline pipeline,
        @Valid @NotNull Ffmpeg ffmpeg,
        @Valid @NotNull Script script,
        @Valid @NotNull Speech speech,
        @Valid @NotNull MediaSearch mediaSearch,
        @Valid @NotNull Placeholder placeholder,
        @Valid @NotNull Http http) {

    public record Storage(
            @NotBlank String outputDir,
            @NotBlank String workDir) {
    }

    public record Pipeline(
            @Positive int concurrency,
            @PositiveOrZero int queueCapacity,
            @Positive int maxScenes) {
    }

    public record Ffmpeg(
            @NotBlank String binary,
            @NotNull Duration timeout) {
    }

    public record Script(
            @NotBlank String baseUrl,
            String apiKey,
            @NotBlank String model) {
    }

    public record Speech(
            @NotBlank String baseUrl,
            String apiKey,
            @NotBlank String model,
            @NotBlank String voice,
            @Positive int maxChunkChars) {
    }

    public record MediaSearch(
            @NotBlank String baseUrl,
            String apiKey,
            @NotBlank String imageBaseUrl) {
    }

    public record Placeholder(
            @NotBlank String baseUrl,
            @NotBlank String background,
            @NotBlank String foreground) {
    }

    public record Http(
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout) {
    }
}
