package com.dmarcradar.classification.sender;

import com.dmarcradar.domain.ThirdPartySender;
import com.dmarcradar.domain.ThirdPartySenderRepository;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Answers "is this signing domain a known legitimate sender?" from the enabled senders, compiled once per
 * cache load (TTL from {@code dmarcradar.classification.sender-cache-ttl-seconds}).
 * {@link ThirdPartySenderService} invalidates the cache after every write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ThirdPartySenderMatcher {

    static final String ENABLED_KEY = "enabled";

    private final ThirdPartySenderRepository thirdPartySenderRepository;
    private final Cache<String, List<CompiledSender>> thirdPartySenderCache;

    public List<ThirdPartySender> findEnabled() {
        return compiled().stream().map(CompiledSender::sender).toList();
    }

    public Optional<ThirdPartySender> matchesDkim(String domain) {
        return match(domain, CompiledSender::dkim);
    }

    public Optional<ThirdPartySender> matchesSpf(String domain) {
        return match(domain, CompiledSender::spf);
    }

    public void invalidate() {
        thirdPartySenderCache.invalidateAll();
    }

    private Optional<ThirdPartySender> match(String domain, Function<CompiledSender, Pattern> patternOf) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        for (CompiledSender c : compiled()) {
            Pattern p = patternOf.apply(c);
            if (p != null && p.matcher(domain).find()) {
                return Optional.of(c.sender());
            }
        }
        return Optional.empty();
    }

    private List<CompiledSender> compiled() {
        return thirdPartySenderCache.get(ENABLED_KEY, k -> load());
    }

    private List<CompiledSender> load() {
        List<CompiledSender> out = new ArrayList<>();
        for (ThirdPartySender s : thirdPartySenderRepository.findByEnabledTrueOrderByNameAsc()) {
            out.add(new CompiledSender(s, compile(s.getName(), s.getDkimPattern()), compile(s.getName(), s.getSpfPattern())));
        }
        log.debug("Loaded {} enabled third-party senders", out.size());
        return List.copyOf(out);
    }

    /** Null for blank patterns; rows written outside the service may hold invalid ones, which never match. */
    static Pattern compile(String senderName, String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid pattern '{}' of third-party sender {}: {}", pattern, senderName, e.getDescription());
            return null;
        }
    }

    public record CompiledSender(ThirdPartySender sender, Pattern dkim, Pattern spf) {
    }
}
