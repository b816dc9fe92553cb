package com.chartsignal.backend.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class RestTemplateConfigTest {

    private BybitApiConfig bybitApiConfig;

    @BeforeEach
    void setUp() {
        bybitApiConfig = new BybitApiConfig();
        bybitApiConfig.setConnectTimeoutSeconds(3);
        bybitApiConfig.setReadTimeoutSeconds(7);
        bybitApiConfig.setUserAgent("Chart-Signal-Test/1.0");
    }

    @Test
    void restTemplate_shouldUseConfiguredTimeouts() {
        RestTemplate restTemplate = new RestTemplateConfig().restTemplate(new RestTemplateBuilder(), bybitApiConfig);

        ClientHttpRequestFactory requestFactory = restTemplate.getRequestFactory();
        assertTrue(requestFactory instanceof SimpleClientHttpRequestFactory);
        assertEquals(3000, ReflectionTestUtils.getField(requestFactory, "connectTimeout"));
        assertEquals(7000, ReflectionTestUtils.getField(requestFactory, "readTimeout"));
    }

    @Test
    void restTemplate_shouldSendConfiguredUserAgentAndAcceptJson() {
        RestTemplate restTemplate = new RestTemplateConfig().restTemplate(new RestTemplateBuilder(), bybitApiConfig);
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo(bybitApiConfig.getKlineUrl()))
                .andExpect(header("User-Agent", "Chart-Signal-Test/1.0"))
                .andExpect(header("Accept", MediaType.APPLICATION_JSON_VALUE))
                .andRespond(withSuccess("{\"retCode\":0}", MediaType.APPLICATION_JSON));

        restTemplate.getForObject(bybitApiConfig.getKlineUrl(), String.class);

        server.verify();
    }

    @Test
    void bybitApiConfig_shouldDefaultToTenAndThirtySecondTimeouts() {
        BybitApiConfig defaults = new BybitApiConfig();

        assertEquals(10, defaults.getConnectTimeoutSeconds());
        assertEquals(30, defaults.getReadTimeoutSeconds());
    }
}
