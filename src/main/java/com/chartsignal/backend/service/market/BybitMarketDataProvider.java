package com.chartsignal.backend.service.market;

import com.chartsignal.backend.config.BybitApiConfig;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.service.client.HttpClientService;
import com.chartsignal.backend.service.util.QueryStringUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Candles from the Bybit V5 public kline endpoint.
 */
@Service
public class BybitMarketDataProvider implements MarketDataProvider {

    private static final Logger logger = LoggerFactory.getLogger(BybitMarketDataProvider.class);

    private final BybitApiConfig bybitApiConfig;
    private final HttpClientService httpClientService;
    private final ObjectMapper objectMapper;

    public BybitMarketDataProvider(BybitApiConfig bybitApiConfig, HttpClientService httpClientService,
                                   ObjectMapper objectMapper) {
        this.bybitApiConfig = bybitApiConfig;
        this.httpClientService = httpClientService;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Candle> getCandles(String symbol, Timeframe timeframe, int limit, Long startTime, Long endTime) {
        int effectiveLimit = Math.min(Math.max(limit, 1), bybitApiConfig.getMaxKlineLimit());

        ResponseEntity<String> response = requestKlines(symbol, timeframe, effectiveLimit, startTime, endTime,
                bybitApiConfig.getCategory());

        // Coins without a perpetual contract are only listed on spot
        if (isSymbolNotFound(response) && bybitApiConfig.getFallbackCategory() != null
                && !bybitApiConfig.getFallbackCategory().equalsIgnoreCase(bybitApiConfig.getCategory())) {
            logger.info("{} not found in {} category, trying {}", symbol, bybitApiConfig.getCategory(),
                    bybitApiConfig.getFallbackCategory());
            response = requestKlines(symbol, timeframe, effectiveLimit, startTime, endTime,
                    bybitApiConfig.getFallbackCategory());
        }

        return parseKlineResponse(response, symbol, timeframe);
    }

    private ResponseEntity<String> requestKlines(String symbol, Timeframe timeframe, int limit,
                                                 Long startTime, Long endTime, String category) {
        Map<String, String> params = new HashMap<>();
        params.put("category", category);
        params.put("symbol", symbol);
        params.put("interval", timeframe.getBybitInterval());
        params.put("limit", String.valueOf(limit));
        params.put("start", startTime != null ? String.valueOf(startTime) : null);
        params.put("end", endTime != null ? String.valueOf(endTime) : null);

        String url = bybitApiConfig.getKlineUrl() + "?" + QueryStringUtil.buildQueryString(params);
        logger.debug("Bybit kline request: {}", url);

        try {
            return httpClientService.get(url, createPublicHeaders(), String.class, null);
        } catch (RestClientException e) {
            throw new MarketDataException("Kline request failed for " + symbol + " " + timeframe + ": " + e.getMessage(), e);
        }
    }

    private boolean isSymbolNotFound(ResponseEntity<String> response) {
        if (response == null || response.getBody() == null) {
            return false;
        }
        String body = response.getBody();
        return body.contains("\"retCode\":10001") || body.contains("\"retCode\":110001")
                || body.toLowerCase().contains("symbol not found") || body.contains("Not supported symbols");
    }

    List<Candle> parseKlineResponse(ResponseEntity<String> response, String symbol, Timeframe timeframe) {
        if (response == null || !response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new MarketDataException("Bybit kline request for " + symbol + " " + timeframe + " returned "
                    + (response == null ? "no response" : response.getStatusCode()));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Unreadable kline response for " + symbol + ": " + e.getOriginalMessage(), e);
        }

        int retCode = root.path("retCode").asInt(0);
        if (retCode != 0) {
            throw new MarketDataException("Bybit rejected kline request for " + symbol + ": "
                    + retCode + " " + root.path("retMsg").asText());
        }

        JsonNode rows = root.path("result").path("list");
        if (rows.isMissingNode() || !rows.isArray()) {
            throw new MarketDataException("Kline list missing in Bybit response for " + symbol);
        }

        // Rows arrive newest first; keyed by open time to sort and drop duplicates
        TreeMap<Long, Candle> byOpenTime = new TreeMap<>();
        for (JsonNode row : rows) {
            if (!row.isArray() || row.size() < 6) {
                logger.warn("Skipping malformed kline row for {}: {}", symbol, row);
                continue;
            }
            long openTime = row.get(0).asLong();
            double close = row.get(4).asDouble();
            double volume = row.get(5).asDouble();
            double turnover = row.size() > 6 ? row.get(6).asDouble() : volume * close;
            byOpenTime.put(openTime, new Candle(
                    openTime,
                    openTime + timeframe.getDurationMillis() - 1,
                    row.get(1).asDouble(),
                    row.get(2).asDouble(),
                    row.get(3).asDouble(),
                    close,
                    volume,
                    turnover,
                    0L));
        }

        if (byOpenTime.isEmpty()) {
            logger.warn("Bybit returned no candles for {} {}", symbol, timeframe);
            return Collections.emptyList();
        }

        List<Candle> candles = new ArrayList<>(byOpenTime.values());
        logger.debug("Parsed {} candles for {} {}", candles.size(), symbol, timeframe);
        return candles;
    }

    private HttpHeaders createPublicHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}
