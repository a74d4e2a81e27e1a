package com.starscape.imagepipeline;

import com.starscape.imagepipeline.common.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class ImagePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImagePipelineApplication.class, args);
    }
}
