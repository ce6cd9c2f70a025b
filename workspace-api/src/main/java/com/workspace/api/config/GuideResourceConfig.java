package com.workspace.api.config;

import com.workspace.core.config.WorkspaceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Serves exported study guides (markdown and PDF) from the guide directory.
 */
@Configuration
@RequiredArgsConstructor
public class GuideResourceConfig implements WebMvcConfigurer {

    private final WorkspaceProperties properties;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        WorkspaceProperties.Guides guides = properties.getGuides();
        String prefix = guides.getUrlPrefix().endsWith("/") ? guides.getUrlPrefix() : guides.getUrlPrefix() + "/";
        String location = Paths.get(guides.getDirectory()).toAbsolutePath().toUri().toString();
        registry.addResourceHandler(prefix + "**")
            .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
