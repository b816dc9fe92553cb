package com.chartsignal.backend.service.market;

import com.chartsignal.backend.config.CacheConfig;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validated, cached access to candles for the analysis layer.
 */
@Service
public class MarketDataService {

    private static final Logger logger = LoggerFactory.getLogger(MarketDataService.class);

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9]{2,20}$");

    private final MarketDataProvider marketDataProvider;

    public MarketDataService(MarketDataProvider marketDataProvider) {
        this.marketDataProvider = marketDataProvider;
    }

    /**
     * Upper-cases the symbol and strips separators such as {@code /}, {@code -} and {@code _}.
     *
     * @throws IllegalArgumentException when the result is not 2 to 20 letters or digits
     */
    public static String normalizeSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Symbol cannot be null");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT).replaceAll("[/_\\-]", "");
        if (!SYMBOL_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid symbol: " + symbol);
        }
        return normalized;
    }

    @Cacheable(value = CacheConfig.CANDLE_CACHE, key = "#symbol + ':' + #timeframe.code + ':' + #limit")
    public List<Candle> getCandles(String symbol, Timeframe timeframe, int limit) {
        logger.debug("Fetching {} {} candles for {}", limit, timeframe, symbol);
        return marketDataProvider.getCandles(symbol, timeframe, limit);
    }
}
