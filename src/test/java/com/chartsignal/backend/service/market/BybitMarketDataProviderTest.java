package com.chartsignal.backend.service.market;

import com.chartsignal.backend.config.BybitApiConfig;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.service.client.HttpClientService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class BybitMarketDataProviderTest {

    private static final String KLINE_RESPONSE = "{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"category\":\"linear\","
            + "\"symbol\":\"BTCUSDT\",\"list\":["
            + "[\"1700007200000\",\"102\",\"104\",\"101\",\"103\",\"12.5\",\"1287.5\"],"
            + "[\"1700003600000\",\"101\",\"103\",\"100\",\"102\",\"10\",\"1020\"],"
            + "[\"1700003600000\",\"101\",\"103\",\"100\",\"102\",\"10\",\"1020\"],"
            + "[\"1700000000000\",\"100\",\"102\",\"99\",\"101\",\"8\",\"808\"],"
            + "[\"broken\"]]},\"time\":1700007300000}";

    private static final String NOT_FOUND_RESPONSE =
            "{\"retCode\":10001,\"retMsg\":\"Not supported symbols\",\"result\":{},\"time\":1700007300000}";

    @Mock
    private HttpClientService httpClientService;

    private BybitApiConfig bybitApiConfig;
    private BybitMarketDataProvider provider;

    @BeforeEach
    void setUp() {
        bybitApiConfig = new BybitApiConfig();
        provider = new BybitMarketDataProvider(bybitApiConfig, httpClientService, new ObjectMapper());
    }

    @Test
    void getCandles_shouldReturnAscendingDistinctCandles() {
        when(httpClientService.get(anyString(), any(HttpHeaders.class), eq(String.class), isNull()))
                .thenReturn(new ResponseEntity<>(KLINE_RESPONSE, HttpStatus.OK));

        List<Candle> candles = provider.getCandles("BTCUSDT", Timeframe.H1, 3);

        assertEquals(3, candles.size());
        assertEquals(1700000000000L, candles.get(0).getOpenTime());
        assertEquals(1700003600000L, candles.get(1).getOpenTime());
        assertEquals(1700007200000L, candles.get(2).getOpenTime());

        Candle latest = candles.get(2);
        assertEquals(1700007200000L + Timeframe.H1.getDurationMillis() - 1, latest.getCloseTime());
        assertEquals(102.0, latest.getOpen(), 1e-9);
        assertEquals(104.0, latest.getHigh(), 1e-9);
        assertEquals(101.0, latest.getLow(), 1e-9);
        assertEquals(103.0, latest.getClose(), 1e-9);
        assertEquals(12.5, latest.getVolume(), 1e-9);
        assertEquals(1287.5, latest.getQuoteVolume(), 1e-9);
    }

    @Test
    void getCandles_shouldSendKlineQueryParameters() {
        when(httpClientService.get(anyString(), any(HttpHeaders.class), eq(String.class), isNull()))
                .thenReturn(new ResponseEntity<>(KLINE_RESPONSE, HttpStatus.OK));

        provider.getCandles("BTCUSDT", Timeframe.H4, 5000);

        verify(httpClientService).get(
                eq("https://api.bybit.com/v5/market/kline?category=linear&interval=240&limit=1000&symbol=BTCUSDT"),
                any(HttpHeaders.class), eq(String.class), isNull());
    }

    @Test
    void getCandles_shouldFallBackToSpotWhenSymbolIsNotListed() {
        when(httpClientService.get(contains("category=linear"), any(HttpHeaders.class), eq(String.class), isNull()))
                .thenReturn(new ResponseEntity<>(NOT_FOUND_RESPONSE, HttpStatus.OK));
        when(httpClientService.get(contains("category=spot"), any(HttpHeaders.class), eq(String.class), isNull()))
                .thenReturn(new ResponseEntity<>(KLINE_RESPONSE, HttpStatus.OK));

        List<Candle> candles = provider.getCandles("PEPEUSDT", Timeframe.M15, 3);

        assertEquals(3, candles.size());
        verify(httpClientService).get(contains("category=spot"), any(HttpHeaders.class), eq(String.class), isNull());
    }

    @Test
    void getCandles_shouldNotFallBackWhenCategoriesMatch() {
        bybitApiConfig.setFallbackCategory("linear");
        when(httpClientService.get(anyString(), any(HttpHeaders.class), eq(String.class), isNull()))
                .thenReturn(new ResponseEntity<>(NOT_FOUND_RESPONSE, HttpStatus.OK));

        MarketDataException exception = assertThrows(MarketDataException.class,
                () -> provider.getCandles("PEPEUSDT", Timeframe.M15, 3));

        assertTrue(exception.getMessage().contains("10001"));
        verify(httpClientService, never()).get(contains("category=spot"), any(HttpHeaders.class), eq(String.class), isNull());
    }

    @Test
    void getCandles_shouldWrapTransportErrors() {
        when(httpClientService.get(anyString(), any(HttpHeaders.class), eq(String.class), isNull()))
                .thenThrow(new ResourceAccessException("Connection refused"));

        MarketDataException exception = assertThrows(MarketDataException.class,
                () -> provider.getCandles("BTCUSDT", Timeframe.H1, 100));

        assertTrue(exception.getMessage().contains("Connection refused"));
    }

    @Test
    void parseKlineResponse_shouldRejectErrorStatus() {
        assertThrows(MarketDataException.class, () -> provider.parseKlineResponse(
                new ResponseEntity<>("{}", HttpStatus.BAD_GATEWAY), "BTCUSDT", Timeframe.H1));
    }

    @Test
    void parseKlineResponse_shouldRejectMissingList() {
        assertThrows(MarketDataException.class, () -> provider.parseKlineResponse(
                new ResponseEntity<>("{\"retCode\":0,\"result\":{}}", HttpStatus.OK), "BTCUSDT", Timeframe.H1));
    }

    @Test
    void parseKlineResponse_withEmptyList_shouldReturnNoCandles() {
        List<Candle> candles = provider.parseKlineResponse(
                new ResponseEntity<>("{\"retCode\":0,\"result\":{\"list\":[]}}", HttpStatus.OK), "BTCUSDT", Timeframe.H1);

        assertTrue(candles.isEmpty());
    }
}
