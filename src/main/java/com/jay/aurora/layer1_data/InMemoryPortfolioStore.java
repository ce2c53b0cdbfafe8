package com.jay.aurora.layer1_data;

import com.jay.aurora.model.PortfolioContext;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Default store; every ticker is stand-alone until a context is saved for it. */
@Component
public class InMemoryPortfolioStore implements PortfolioStore {

    private final Map<String, PortfolioContext> contexts = new ConcurrentHashMap<>();

    public void save(String ticker, PortfolioContext context) {
        contexts.put(ticker.trim().toUpperCase(Locale.ROOT), context);
    }

    public void remove(String ticker) {
        contexts.remove(ticker.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public Optional<PortfolioContext> findContext(String ticker) {
        if (ticker == null) return Optional.empty();
        return Optional.ofNullable(contexts.get(ticker.trim().toUpperCase(Locale.ROOT)));
    }
}
