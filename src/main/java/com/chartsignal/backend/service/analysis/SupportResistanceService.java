package com.chartsignal.backend.service.analysis;

import com.chartsignal.backend.config.AnalysisProperties;
import com.chartsignal.backend.model.Candle;
import com.chartsignal.backend.model.LevelStrength;
import com.chartsignal.backend.model.LevelType;
import com.chartsignal.backend.model.PriceRange;
import com.chartsignal.backend.model.SupportResistanceAnalysis;
import com.chartsignal.backend.model.SupportResistanceAnalysis.CurrentPosition;
import com.chartsignal.backend.model.SupportResistanceAnalysis.KeyLevelSet;
import com.chartsignal.backend.model.SupportResistanceAnalysis.PriceAction;
import com.chartsignal.backend.model.SupportResistanceAnalysis.TradingZone;
import com.chartsignal.backend.model.SupportResistanceAnalysis.TradingZones;
import com.chartsignal.backend.model.SupportResistanceLevel;
import com.chartsignal.backend.model.Timeframe;
import com.chartsignal.backend.model.TouchLevel;
import com.chartsignal.backend.service.util.TechnicalAnalysisUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finds support and resistance zones from swing extremes and volume spikes,
 * scores them and merges overlapping zones across timeframes.
 */
@Service
public class SupportResistanceService {

    private static final Logger logger = LoggerFactory.getLogger(SupportResistanceService.class);

    private static final double SIDE_MARGIN = 0.001;
    private static final double VOLUME_SPIKE_MULTIPLIER = 2.0;
    private static final double VOLUME_SIDE_MARGIN = 0.005;
    private static final double VOLUME_LEVEL_RANGE = 0.005;
    private static final int VOLUME_LEVEL_CONFIDENCE = 70;
    private static final double MERGE_TOLERANCE = 0.01;
    private static final int MIN_CONFIDENCE = 40;
    private static final int ACTIVE_LOOKBACK = 10;
    private static final double BREACH_MARGIN = 0.01;
    private static final double APPROACH_DISTANCE = 0.02;
    private static final int ZONE_MIN_CONFIDENCE = 60;

    // Touch levels used by the pattern detectors
    private static final int TOUCH_MIN_CANDLES = 50;
    private static final int TOUCH_WINDOW = 5;
    private static final double TOUCH_TOLERANCE = 0.005;
    private static final int TOUCH_MAX_STRENGTH = 10;

    private final AnalysisProperties properties;

    public SupportResistanceService(AnalysisProperties properties) {
        this.properties = properties;
    }

    /**
     * Builds the merged support/resistance picture from every supplied timeframe.
     * The current price is the last close of the finest timeframe present;
     * timeframes without candles are skipped.
     */
    public SupportResistanceAnalysis analyze(String symbol, Map<Timeframe, List<Candle>> candlesByTimeframe) {
        Optional<Timeframe> finest = candlesByTimeframe.entrySet().stream()
                .filter(entry -> entry.getValue() != null && !entry.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .min(Comparator.comparingInt(Timeframe::getWeight));

        if (finest.isEmpty()) {
            logger.warn("No candles supplied for support/resistance analysis of {}", symbol);
            return SupportResistanceAnalysis.builder()
                    .symbol(symbol)
                    .keyLevels(new KeyLevelSet())
                    .currentPosition(new CurrentPosition(true, null, null, false, false, PriceAction.CONSOLIDATING))
                    .tradingZones(new TradingZones())
                    .build();
        }

        double currentPrice = TechnicalAnalysisUtil.last(candlesByTimeframe.get(finest.get())).getClose();

        // Highest timeframe first so its levels anchor the merge
        List<SupportResistanceLevel> allLevels = new ArrayList<>();
        candlesByTimeframe.entrySet().stream()
                .filter(entry -> entry.getValue() != null && !entry.getValue().isEmpty())
                .sorted((a, b) -> Integer.compare(b.getKey().getWeight(), a.getKey().getWeight()))
                .forEach(entry -> allLevels.addAll(identifyLevels(entry.getValue(), entry.getKey(), currentPrice)));

        List<SupportResistanceLevel> consolidated = consolidateLevels(allLevels, currentPrice);

        List<SupportResistanceLevel> supports = consolidated.stream()
                .filter(level -> level.getType() == LevelType.SUPPORT)
                .sorted(Comparator.comparingDouble((SupportResistanceLevel level) -> level.getPriceRange().getCenter()).reversed())
                .collect(Collectors.toList());
        List<SupportResistanceLevel> resistances = consolidated.stream()
                .filter(level -> level.getType() == LevelType.RESISTANCE)
                .sorted(Comparator.comparingDouble(level -> level.getPriceRange().getCenter()))
                .collect(Collectors.toList());

        logger.info("Support/resistance analysis for {} found {} supports and {} resistances",
                symbol, supports.size(), resistances.size());

        return SupportResistanceAnalysis.builder()
                .symbol(symbol)
                .timestamp(latestOpenTime(candlesByTimeframe))
                .currentPrice(currentPrice)
                .supports(supports)
                .resistances(resistances)
                .keyLevels(identifyKeyLevels(supports, resistances, currentPrice))
                .currentPosition(analyzeCurrentPosition(supports, resistances, currentPrice))
                .tradingZones(generateTradingZones(supports, resistances))
                .build();
    }

    /**
     * Raw, unmerged levels of one timeframe: swing highs above and swing lows
     * below the current price, plus zones around volume spikes.
     */
    public List<SupportResistanceLevel> identifyLevels(List<Candle> candles, Timeframe timeframe, double currentPrice) {
        List<SupportResistanceLevel> levels = new ArrayList<>();
        if (candles.isEmpty()) {
            return levels;
        }

        double volatility = TechnicalAnalysisUtil.returnVolatility(candles);
        int lookback = properties.getSwingLookback();

        for (int index : findSwingHighs(candles, lookback)) {
            double price = candles.get(index).getHigh();
            if (price > currentPrice * (1 + SIDE_MARGIN)) {
                levels.add(createSwingLevel(LevelType.RESISTANCE, price, candles.get(index).getOpenTime(),
                        candles, timeframe, currentPrice, volatility));
            }
        }

        for (int index : findSwingLows(candles, lookback)) {
            double price = candles.get(index).getLow();
            if (price < currentPrice * (1 - SIDE_MARGIN)) {
                levels.add(createSwingLevel(LevelType.SUPPORT, price, candles.get(index).getOpenTime(),
                        candles, timeframe, currentPrice, volatility));
            }
        }

        levels.addAll(identifyVolumeLevels(candles, timeframe, currentPrice));
        logger.debug("{} raw levels on {}", levels.size(), timeframe);
        return levels;
    }

    /**
     * Indices whose high is greater than or equal to every high within {@code lookback} candles on both sides.
     */
    public List<Integer> findSwingHighs(List<Candle> candles, int lookback) {
        List<Integer> swings = new ArrayList<>();
        for (int i = lookback; i < candles.size() - lookback; i++) {
            double high = candles.get(i).getHigh();
            boolean swing = true;
            for (int j = i - lookback; j <= i + lookback; j++) {
                if (candles.get(j).getHigh() > high) {
                    swing = false;
                    break;
                }
            }
            if (swing) {
                swings.add(i);
            }
        }
        return swings;
    }

    public List<Integer> findSwingLows(List<Candle> candles, int lookback) {
        List<Integer> swings = new ArrayList<>();
        for (int i = lookback; i < candles.size() - lookback; i++) {
            double low = candles.get(i).getLow();
            boolean swing = true;
            for (int j = i - lookback; j <= i + lookback; j++) {
                if (candles.get(j).getLow() < low) {
                    swing = false;
                    break;
                }
            }
            if (swing) {
                swings.add(i);
            }
        }
        return swings;
    }

    private SupportResistanceLevel createSwingLevel(LevelType type, double price, long touchTime, List<Candle> candles,
                                                    Timeframe timeframe, double currentPrice, double volatility) {
        double range = price * volatility * 0.5;
        int touchCount = countTouches(candles, price, range, type);
        LevelStrength strength = calculateStrength(touchCount, timeframe, price, currentPrice);
        int confidence = calculateConfidence(touchCount, strength, timeframe, volatility);

        return SupportResistanceLevel.builder()
                .type(type)
                .priceRange(new PriceRange(price - range, price + range, price))
                .strength(strength)
                .confidence(confidence)
                .touchCount(touchCount)
                .lastTouchTimestamp(touchTime)
                .timeframe(timeframe)
                .active(isLevelActive(price, currentPrice, candles))
                .distance(distancePercent(type, price, currentPrice))
                .description(String.format(Locale.ROOT, "%s %s %s at %.5f, touched %d times",
                        timeframe.getCode(), strength, type.name().toLowerCase(Locale.ROOT), price, touchCount))
                .build();
    }

    List<SupportResistanceLevel> identifyVolumeLevels(List<Candle> candles, Timeframe timeframe, double currentPrice) {
        double totalVolume = 0.0;
        for (Candle candle : candles) {
            totalVolume += candle.getVolume();
        }
        double threshold = totalVolume / candles.size() * VOLUME_SPIKE_MULTIPLIER;

        List<SupportResistanceLevel> levels = new ArrayList<>();
        for (Candle candle : candles) {
            if (candle.getVolume() <= threshold) {
                continue;
            }
            if (candle.getHigh() > currentPrice * (1 + VOLUME_SIDE_MARGIN)) {
                levels.add(createVolumeLevel(LevelType.RESISTANCE, candle.getHigh(), candle, timeframe, currentPrice));
            }
            if (candle.getLow() < currentPrice * (1 - VOLUME_SIDE_MARGIN)) {
                levels.add(createVolumeLevel(LevelType.SUPPORT, candle.getLow(), candle, timeframe, currentPrice));
            }
        }
        return levels;
    }

    private SupportResistanceLevel createVolumeLevel(LevelType type, double price, Candle candle,
                                                     Timeframe timeframe, double currentPrice) {
        double range = price * VOLUME_LEVEL_RANGE;
        return SupportResistanceLevel.builder()
                .type(type)
                .priceRange(new PriceRange(price - range, price + range, price))
                .strength(LevelStrength.MEDIUM)
                .confidence(VOLUME_LEVEL_CONFIDENCE)
                .touchCount(1)
                .lastTouchTimestamp(candle.getOpenTime())
                .timeframe(timeframe)
                .active(true)
                .distance(distancePercent(type, price, currentPrice))
                .description(String.format(Locale.ROOT, "%s high-volume %s zone at %.5f",
                        timeframe.getCode(), type.name().toLowerCase(Locale.ROOT), price))
                .build();
    }

    int countTouches(List<Candle> candles, double price, double range, LevelType type) {
        double min = price - range;
        double max = price + range;
        int touches = 0;
        for (Candle candle : candles) {
            double extreme = type == LevelType.SUPPORT ? candle.getLow() : candle.getHigh();
            if (extreme >= min && extreme <= max) {
                touches++;
            }
        }
        return touches;
    }

    LevelStrength calculateStrength(int touchCount, Timeframe timeframe, double price, double currentPrice) {
        int score;
        if (touchCount >= 5) {
            score = 4;
        } else if (touchCount >= 3) {
            score = 3;
        } else if (touchCount >= 2) {
            score = 2;
        } else {
            score = 1;
        }

        score += timeframe.getWeight();

        double distance = Math.abs(price - currentPrice) / currentPrice;
        if (distance < 0.05) {
            score += 2;
        } else if (distance < 0.1) {
            score += 1;
        }
        return LevelStrength.fromScore(score);
    }

    int calculateConfidence(int touchCount, LevelStrength strength, Timeframe timeframe, double volatility) {
        double confidence = 50 + touchCount * 10 + strength.getConfidenceBonus() + timeframeBonus(timeframe);
        if (volatility < 0.02) {
            confidence += 10;
        } else if (volatility > 0.05) {
            confidence -= 10;
        }
        return (int) Math.round(TechnicalAnalysisUtil.clamp(confidence, 0, 100));
    }

    private static int timeframeBonus(Timeframe timeframe) {
        switch (timeframe) {
            case D1:
                return 15;
            case H4:
                return 10;
            case H1:
                return 5;
            default:
                return 0;
        }
    }

    /**
     * A level is inactive once any of the last candles closed more than 1% through it.
     */
    boolean isLevelActive(double price, double currentPrice, List<Candle> candles) {
        int from = Math.max(0, candles.size() - ACTIVE_LOOKBACK);
        for (int i = from; i < candles.size(); i++) {
            double close = candles.get(i).getClose();
            if (price < currentPrice && close < price * (1 - BREACH_MARGIN)) {
                return false;
            }
            if (price > currentPrice && close > price * (1 + BREACH_MARGIN)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Merges same-type levels whose centers lie within 1% of the current price of
     * each other, then drops levels under the minimum confidence. Passes repeat
     * until nothing merges, so running this on its own output returns an equal list.
     */
    public List<SupportResistanceLevel> consolidateLevels(List<SupportResistanceLevel> levels, double currentPrice) {
        double tolerance = currentPrice * MERGE_TOLERANCE;
        List<SupportResistanceLevel> current = new ArrayList<>(levels);

        boolean merged = true;
        while (merged) {
            merged = false;
            List<SupportResistanceLevel> next = new ArrayList<>();
            for (SupportResistanceLevel level : current) {
                int match = -1;
                for (int i = 0; i < next.size(); i++) {
                    SupportResistanceLevel existing = next.get(i);
                    if (existing.getType() == level.getType()
                            && Math.abs(existing.getPriceRange().getCenter() - level.getPriceRange().getCenter()) < tolerance) {
                        match = i;
                        break;
                    }
                }
                if (match >= 0) {
                    next.set(match, mergeLevels(next.get(match), level, currentPrice));
                    merged = true;
                } else {
                    next.add(level);
                }
            }
            current = next;
        }

        return current.stream()
                .filter(level -> level.getConfidence() >= MIN_CONFIDENCE)
                .collect(Collectors.toList());
    }

    private SupportResistanceLevel mergeLevels(SupportResistanceLevel existing, SupportResistanceLevel incoming,
                                               double currentPrice) {
        double existingWeight = levelWeight(existing);
        double incomingWeight = levelWeight(incoming);
        double center = (existing.getPriceRange().getCenter() * existingWeight
                + incoming.getPriceRange().getCenter() * incomingWeight) / (existingWeight + incomingWeight);

        PriceRange range = new PriceRange(
                Math.min(existing.getPriceRange().getMin(), incoming.getPriceRange().getMin()),
                Math.max(existing.getPriceRange().getMax(), incoming.getPriceRange().getMax()),
                center);

        return existing.toBuilder()
                .priceRange(range)
                .touchCount(existing.getTouchCount() + incoming.getTouchCount())
                .confidence(Math.min(existing.getConfidence() + 10, 100))
                .strength(LevelStrength.stronger(existing.getStrength(), incoming.getStrength()))
                .lastTouchTimestamp(Math.max(existing.getLastTouchTimestamp(), incoming.getLastTouchTimestamp()))
                .active(existing.isActive() && incoming.isActive())
                .distance(distancePercent(existing.getType(), center, currentPrice))
                .build();
    }

    static int levelWeight(SupportResistanceLevel level) {
        return level.getTimeframe().getWeight() * level.getStrength().getWeight();
    }

    private static double distancePercent(LevelType type, double price, double currentPrice) {
        double diff = type == LevelType.RESISTANCE ? price - currentPrice : currentPrice - price;
        return diff / currentPrice * 100;
    }

    KeyLevelSet identifyKeyLevels(List<SupportResistanceLevel> supports, List<SupportResistanceLevel> resistances,
                                  double currentPrice) {
        Comparator<SupportResistanceLevel> byWeight = Comparator.comparingInt(SupportResistanceService::levelWeight);

        SupportResistanceLevel nearestSupport = supports.stream()
                .filter(level -> level.getPriceRange().getCenter() < currentPrice)
                .max(Comparator.comparingDouble(level -> level.getPriceRange().getCenter()))
                .orElse(null);
        SupportResistanceLevel nearestResistance = resistances.stream()
                .filter(level -> level.getPriceRange().getCenter() > currentPrice)
                .min(Comparator.comparingDouble(level -> level.getPriceRange().getCenter()))
                .orElse(null);

        return new KeyLevelSet(nearestSupport, nearestResistance,
                strongest(supports, byWeight), strongest(resistances, byWeight));
    }

    private static SupportResistanceLevel strongest(List<SupportResistanceLevel> levels,
                                                    Comparator<SupportResistanceLevel> byWeight) {
        SupportResistanceLevel best = null;
        for (SupportResistanceLevel level : levels) {
            if (best == null || byWeight.compare(level, best) > 0) {
                best = level;
            }
        }
        return best;
    }

    CurrentPosition analyzeCurrentPosition(List<SupportResistanceLevel> supports,
                                           List<SupportResistanceLevel> resistances, double currentPrice) {
        boolean inSupportZone = supports.stream().anyMatch(level -> level.getPriceRange().contains(currentPrice));
        boolean inResistanceZone = resistances.stream().anyMatch(level -> level.getPriceRange().contains(currentPrice));

        KeyLevelSet nearest = identifyKeyLevels(supports, resistances, currentPrice);
        SupportResistanceLevel nextSupport = nearest.getNearestSupport();
        SupportResistanceLevel nextResistance = nearest.getNearestResistance();

        PriceAction priceAction = PriceAction.CONSOLIDATING;
        if (nextResistance != null
                && (nextResistance.getPriceRange().getCenter() - currentPrice) / currentPrice < APPROACH_DISTANCE) {
            priceAction = PriceAction.APPROACHING_RESISTANCE;
        } else if (nextSupport != null
                && (currentPrice - nextSupport.getPriceRange().getCenter()) / currentPrice < APPROACH_DISTANCE) {
            priceAction = PriceAction.APPROACHING_SUPPORT;
        }

        return new CurrentPosition(!inSupportZone && !inResistanceZone, nextSupport, nextResistance,
                inSupportZone, inResistanceZone, priceAction);
    }

    TradingZones generateTradingZones(List<SupportResistanceLevel> supports, List<SupportResistanceLevel> resistances) {
        List<TradingZone> buyZones = supports.stream()
                .filter(SupportResistanceService::isTradable)
                .map(level -> new TradingZone(level.getPriceRange(),
                        level.getTimeframe().getCode() + " " + level.getStrength() + " support"))
                .collect(Collectors.toList());
        List<TradingZone> sellZones = resistances.stream()
                .filter(SupportResistanceService::isTradable)
                .map(level -> new TradingZone(level.getPriceRange(),
                        level.getTimeframe().getCode() + " " + level.getStrength() + " resistance"))
                .collect(Collectors.toList());
        return new TradingZones(buyZones, sellZones);
    }

    private static boolean isTradable(SupportResistanceLevel level) {
        return level.getStrength() != LevelStrength.WEAK && level.getConfidence() > ZONE_MIN_CONFIDENCE;
    }

    /**
     * Swing prices the series revisited at least twice (within 0.5%), merged and
     * ordered by strength. Returns nothing for fewer than 50 candles.
     */
    public List<TouchLevel> identifyTouchLevels(List<Candle> candles) {
        if (candles.size() < TOUCH_MIN_CANDLES) {
            return new ArrayList<>();
        }

        List<TouchLevel> levels = new ArrayList<>();
        for (int i = TOUCH_WINDOW; i < candles.size() - TOUCH_WINDOW; i++) {
            Candle candidate = candles.get(i);
            boolean localHigh = true;
            boolean localLow = true;
            for (int j = i - TOUCH_WINDOW; j <= i + TOUCH_WINDOW; j++) {
                if (candles.get(j).getHigh() > candidate.getHigh()) {
                    localHigh = false;
                }
                if (candles.get(j).getLow() < candidate.getLow()) {
                    localLow = false;
                }
            }
            if (localHigh) {
                addTouchLevel(levels, candles, candidate.getHigh(), candidate.getOpenTime(), LevelType.RESISTANCE);
            }
            if (localLow) {
                addTouchLevel(levels, candles, candidate.getLow(), candidate.getOpenTime(), LevelType.SUPPORT);
            }
        }
        return consolidateTouchLevels(levels);
    }

    private void addTouchLevel(List<TouchLevel> levels, List<Candle> candles, double price, long time, LevelType type) {
        int touches = 0;
        long firstTouch = time;
        long lastTouch = time;
        for (Candle candle : candles) {
            double extreme = type == LevelType.RESISTANCE ? candle.getHigh() : candle.getLow();
            if (Math.abs(extreme - price) / price <= TOUCH_TOLERANCE) {
                touches++;
                firstTouch = Math.min(firstTouch, candle.getOpenTime());
                lastTouch = Math.max(lastTouch, candle.getOpenTime());
            }
        }
        if (touches >= 2) {
            levels.add(TouchLevel.builder()
                    .price(price)
                    .type(type)
                    .strength(Math.min(touches, TOUCH_MAX_STRENGTH))
                    .touchCount(touches)
                    .firstTouch(firstTouch)
                    .lastTouch(lastTouch)
                    .build());
        }
    }

    List<TouchLevel> consolidateTouchLevels(List<TouchLevel> levels) {
        List<TouchLevel> consolidated = new ArrayList<>();
        for (TouchLevel level : levels) {
            int match = -1;
            for (int i = 0; i < consolidated.size(); i++) {
                TouchLevel existing = consolidated.get(i);
                if (existing.getType() == level.getType()
                        && Math.abs(existing.getPrice() - level.getPrice()) / level.getPrice() <= TOUCH_TOLERANCE) {
                    match = i;
                    break;
                }
            }
            if (match < 0) {
                consolidated.add(level);
                continue;
            }
            TouchLevel existing = consolidated.get(match);
            consolidated.set(match, existing.toBuilder()
                    .strength(Math.max(existing.getStrength(), level.getStrength()))
                    .touchCount(existing.getTouchCount() + level.getTouchCount())
                    .firstTouch(Math.min(existing.getFirstTouch(), level.getFirstTouch()))
                    .lastTouch(Math.max(existing.getLastTouch(), level.getLastTouch()))
                    .build());
        }
        consolidated.sort(Comparator.comparingInt(TouchLevel::getStrength).reversed());
        return consolidated;
    }

    private static long latestOpenTime(Map<Timeframe, List<Candle>> candlesByTimeframe) {
        long latest = 0L;
        for (List<Candle> candles : candlesByTimeframe.values()) {
            if (candles != null && !candles.isEmpty()) {
                latest = Math.max(latest, TechnicalAnalysisUtil.last(candles).getOpenTime());
            }
        }
        return latest;
    }
}
