package com.drinkjoy.catalog.infrastructure.config;

import com.drinkjoy.catalog.infrastructure.adapter.source.SheetsValuesApi;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

@Configuration
public class RetrofitSourceConfig {

    @Bean
    public SheetsValuesApi sheetsValuesApi(SourceProperties sourceProperties) {
        ObjectMapper jsonMapper = new ObjectMapper();
        jsonMapper.registerModule(new JavaTimeModule());
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(sourceProperties.getTimeout())
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(withTrailingSlash(sourceProperties.getBaseUrl()))
                .client(httpClient)
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper))
                .build();

        return retrofit.create(SheetsValuesApi.class);
    }

    private static String withTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }
}
