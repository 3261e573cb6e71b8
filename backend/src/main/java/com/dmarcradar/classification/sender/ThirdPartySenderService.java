package com.dmarcradar.classification.sender;

import com.dmarcradar.domain.ThirdPartySender;
import com.dmarcradar.domain.ThirdPartySenderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * CRUD over third-party senders. Patterns are compiled before anything is written; every write invalidates
 * the matcher cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThirdPartySenderService {

    private final ThirdPartySenderRepository thirdPartySenderRepository;
    private final ThirdPartySenderMatcher thirdPartySenderMatcher;

    public List<ThirdPartySender> findAll() {
        return thirdPartySenderRepository.findAllByOrderByNameAsc();
    }

    public ThirdPartySender findById(String id) {
        return thirdPartySenderRepository.findById(id)
                .orElseThrow(() -> new ThirdPartySenderException(ThirdPartySenderException.SENDER_NOT_FOUND,
                        "Third-party sender with ID " + id + " not found"));
    }

    public ThirdPartySender create(ThirdPartySenderCommand command) {
        validatePattern("DKIM", command.dkimPattern());
        validatePattern("SPF", command.spfPattern());
        Instant now = Instant.now();
        ThirdPartySender sender = new ThirdPartySender();
        sender.setName(command.name());
        sender.setDescription(command.description());
        sender.setDkimPattern(command.dkimPattern());
        sender.setSpfPattern(command.spfPattern());
        sender.setEnabled(command.enabled() == null || command.enabled());
        sender.setCreatedAt(now);
        sender.setUpdatedAt(now);
        ThirdPartySender saved = thirdPartySenderRepository.save(sender);
        thirdPartySenderMatcher.invalidate();
        log.info("Third-party sender {} created ({})", saved.getId(), saved.getName());
        return saved;
    }

    public ThirdPartySender update(String id, ThirdPartySenderCommand command) {
        ThirdPartySender sender = findById(id);
        validatePattern("DKIM", command.dkimPattern());
        validatePattern("SPF", command.spfPattern());
        if (command.name() != null) {
            sender.setName(command.name());
        }
        if (command.description() != null) {
            sender.setDescription(command.description());
        }
        if (command.dkimPattern() != null) {
            sender.setDkimPattern(command.dkimPattern());
        }
        if (command.spfPattern() != null) {
            sender.setSpfPattern(command.spfPattern());
        }
        if (command.enabled() != null) {
            sender.setEnabled(command.enabled());
        }
        sender.setUpdatedAt(Instant.now());
        ThirdPartySender saved = thirdPartySenderRepository.save(sender);
        thirdPartySenderMatcher.invalidate();
        return saved;
    }

    public void delete(String id) {
        ThirdPartySender sender = findById(id);
        thirdPartySenderRepository.delete(sender);
        thirdPartySenderMatcher.invalidate();
        log.info("Third-party sender {} deleted ({})", id, sender.getName());
    }

    private static void validatePattern(String kind, String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return;
        }
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ThirdPartySenderException(ThirdPartySenderException.INVALID_PATTERN,
                    "Invalid " + kind + " pattern: " + e.getDescription());
        }
    }
}
