package com.fxplatform.ingestion.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigTest {

    @Test
    void masksCredentialQueryParameters() {
        assertEquals("https://api.currencylayer.com/live?access_key=***&source=USD",
            WebClientConfig.maskCredentials("https://api.currencylayer.com/live?access_key=s3cr3t&source=USD"));
        assertEquals("https://api.fxapi.com/v1/latest?base=USD&apikey=***",
            WebClientConfig.maskCredentials("https://api.fxapi.com/v1/latest?base=USD&apikey=abc123"));
    }

    @Test
    void leavesOtherUrlsAlone() {
        String url = "https://api.exchangerate-api.com/v4/latest/USD";
        assertEquals(url, WebClientConfig.maskCredentials(url));
    }
}
