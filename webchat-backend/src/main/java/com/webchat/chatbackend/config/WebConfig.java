package com.webchat.chatbackend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

// Serves stored attachments under the same base the storage service hands out
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${app.upload.root:uploads}")
    private String uploadRoot;

    @Value("${app.storage.local.web-base:/uploads}")
    private String webBase;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler(webBase.replaceAll("/+$", "") + "/**")
                .addResourceLocations("file:" + Path.of(uploadRoot).toAbsolutePath().normalize() + "/");
    }
}
