package github.sarthakdev143.reel_factory.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * Serves finished reels from the output directory under {@code /videos/**}.
 */
@Configuration
public class StaticVideoConfig implements WebMvcConfigurer {

    public static final String PUBLIC_PATH = "/videos";

    private final String outputDir;

    public StaticVideoConfig(@Value("${reel-factory.storage.output-dir:output}") String outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Path.of(outputDir).toAbsolutePath().normalize().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler(PUBLIC_PATH + "/**").addResourceLocations(location);
    }
}
