package com.gdin.inspection.cognify.config;

import com.gdin.inspection.cognify.index.pipeline.PipelineFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    public PipelineFactory<Object> pipelineFactory() {
        return new PipelineFactory<>();
    }
}
