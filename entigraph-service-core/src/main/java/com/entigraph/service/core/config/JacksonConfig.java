package com.entigraph.service.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Entity views and rule descriptions omit unset optional fields and render instants as ISO strings. */
@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor objectMapperEntityViewCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    om.findAndRegisterModules();
                    om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
                    om.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
                    om.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
                }
                return bean;
            }
        };
    }
}
