package com.robobracket.service;

import com.robobracket.config.RoboBracketProperties;
import com.robobracket.engine.BracketTemplateBuilder;
import com.robobracket.model.GameTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves bracket templates, building each size at most once while caching is enabled.
 */
@Service
public class BracketTemplateService {

    private static final Logger log = LoggerFactory.getLogger(BracketTemplateService.class);

    private final BracketTemplateBuilder bracketTemplateBuilder;
    private final RoboBracketProperties roboBracketProperties;
    private final Map<Integer, List<GameTemplate>> templatesBySize = new ConcurrentHashMap<>();

    public BracketTemplateService(
            BracketTemplateBuilder bracketTemplateBuilder,
            RoboBracketProperties roboBracketProperties
    ) {
        this.bracketTemplateBuilder = bracketTemplateBuilder;
        this.roboBracketProperties = roboBracketProperties;
    }

    public List<GameTemplate> getTemplate(int bracketSize) {
        if (!roboBracketProperties.getBracket().isTemplateCacheEnabled()) {
            return bracketTemplateBuilder.build(bracketSize);
        }
        List<GameTemplate> cached = templatesBySize.get(bracketSize);
        if (cached != null) {
            return cached;
        }
        List<GameTemplate> built = List.copyOf(bracketTemplateBuilder.build(bracketSize));
        List<GameTemplate> previous = templatesBySize.putIfAbsent(bracketSize, built);
        if (previous != null) {
            return previous;
        }
        log.info("Cached bracket template for size {} ({} games)", bracketSize, built.size());
        return built;
    }

    public List<Integer> supportedSizes() {
        return BracketTemplateBuilder.SUPPORTED_SIZES;
    }
}
