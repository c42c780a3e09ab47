package uk.gegc.frontdesk.features.booking.domain.rules;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Slf4j
@Component
public class SectorRuleRegistry {

    private final Map<String, SectorRule> rulesBySector;

    public SectorRuleRegistry(List<SectorRule> rules) {
        Map<String, SectorRule> bySector = new TreeMap<>();
        for (SectorRule rule : rules) {
            String key = normalize(rule.sector());
            if (key.isEmpty()) {
                throw new IllegalStateException("Sector rule " + rule.getClass().getSimpleName() + " has no sector");
            }
            SectorRule existing = bySector.putIfAbsent(key, rule);
            if (existing != null) {
                throw new IllegalStateException("Sector '" + key + "' has two rules: "
                        + existing.getClass().getSimpleName() + " and " + rule.getClass().getSimpleName());
            }
        }
        this.rulesBySector = Collections.unmodifiableMap(bySector);
        log.info("Registered booking rules for sectors {}", rulesBySector.keySet());
    }

    public Optional<SectorRule> find(String sector) {
        if (sector == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rulesBySector.get(normalize(sector)));
    }

    public List<String> registeredSectors() {
        return List.copyOf(rulesBySector.keySet());
    }

    static String normalize(String sector) {
        return sector == null ? "" : sector.trim().toLowerCase(Locale.ROOT);
    }
}
