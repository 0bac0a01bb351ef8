package com.platform.scaffold.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.scaffold.ScaffoldApplication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Writes the OpenAPI document to a file.
 * 
 * Boots the application on a random port with every optional feature composed in
 * (a throwaway token and an in-memory H2 database), downloads /openapi.json and
 * pretty-prints it to the target path.
 * 
 * Usage: {@code OpenApiExporter [output-path]}, default {@code openapi.json}.
 */
@Slf4j
public final class OpenApiExporter {
    
    public static final Path DEFAULT_OUTPUT = Path.of("openapi.json");
    
    // Command-line arguments outrank the process environment
    private static final String[] EXPORT_ARGS = {
        "--server.port=0",
        "--API_KEYS=openapi-export",
        "--DATABASE_URL=jdbc:h2:mem:openapi-export;DB_CLOSE_DELAY=-1",
        "--OTEL_ENABLED=false"
    };
    
    private OpenApiExporter() {
    }
    
    public static void main(String[] args) throws IOException {
        Path output = args.length > 0 ? Path.of(args[0]) : DEFAULT_OUTPUT;
        export(output);
    }
    
    /**
     * @return number of paths in the written document
     */
    public static int export(Path output) throws IOException {
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(ScaffoldApplication.class)
                .logStartupInfo(false)
                .run(EXPORT_ARGS)) {
            
            ObjectMapper mapper = context.getBean(ObjectMapper.class);
            JsonNode document = mapper.readTree(fetch(context));
            
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), document);
            
            int paths = document.path("paths").size();
            log.info("Wrote OpenAPI document with {} paths to {}", paths, output.toAbsolutePath());
            return paths;
        }
    }
    
    private static String fetch(ConfigurableApplicationContext context) {
        int port = context.getEnvironment().getRequiredProperty("local.server.port", Integer.class);
        String docsPath = context.getEnvironment().getProperty("springdoc.api-docs.path", "/v3/api-docs");
        
        RestTemplate restTemplate = context.getBean(RestTemplateBuilder.class)
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(Duration.ofSeconds(10))
            .build();
        
        String body = restTemplate.getForObject("http://127.0.0.1:" + port + docsPath, String.class);
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("Application served an empty OpenAPI document");
        }
        return body;
    }
}
