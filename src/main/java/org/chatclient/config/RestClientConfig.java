package org.chatclient.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate restTemplate(ObjectMapper objectMapper, SessionCookieInterceptor cookies) {
        RestTemplate restTemplate = new RestTemplate();

        // certaines erreurs du serveur repartent en text/html : on les lit quand même en JSON
        MappingJackson2HttpMessageConverter json = new MappingJackson2HttpMessageConverter(objectMapper);
        json.setSupportedMediaTypes(List.of(
                MediaType.APPLICATION_JSON,
                new MediaType("application", "*+json"),
                MediaType.TEXT_PLAIN,
                MediaType.TEXT_HTML));
        restTemplate.getMessageConverters().add(0, json);

        restTemplate.getInterceptors().add(cookies);
        return restTemplate;
    }
}
