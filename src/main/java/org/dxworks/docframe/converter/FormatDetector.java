package org.dxworks.docframe.converter;

import org.dxworks.docframe.exception.FormatDetectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Picks the format of an input from its filename, MIME type, magic bytes and, when those
 * leave several candidates, the candidates' content detectors.
 * <p>
 * Only a bounded prefix of the content is read. Candidate lists always keep registration order,
 * which is the final tie-break after priority.
 */
class FormatDetector {

    private static final Logger LOG = LoggerFactory.getLogger(FormatDetector.class);

    private final int prefixLimit;

    FormatDetector(int prefixLimit) {
        this.prefixLimit = prefixLimit;
    }

    int getPrefixLimit() {
        return prefixLimit;
    }

    ConverterMetadata detect(DocumentInput input, Collection<ConverterMetadata> formats) {
        String name = input.describe();
        if (formats.isEmpty()) {
            throw new FormatDetectionException(name, "Cannot detect the format of " + name + ": no formats are registered");
        }

        byte[] prefix = readPrefix(input);
        DetectionContext context = new DetectionContext(prefix, input.path().orElse(null), input.filename().orElse(null),
                input.buffer().orElse(null));

        List<ConverterMetadata> byExtension = input.filename()
                .map(filename -> filter(formats, f -> f.matchesFilename(filename)))
                .orElse(List.of());
        List<ConverterMetadata> byMime = input.mimeType()
                .map(mime -> filter(formats, f -> f.matchesMimeType(mime)))
                .orElse(List.of());
        List<ConverterMetadata> byMagic = filter(formats, f -> f.matchesMagic(prefix));
        LOG.debug("Detecting {}: extension={} mime={} magic={}", name, byExtension, byMime, byMagic);

        List<ConverterMetadata> candidates = combine(formats, byMagic, byMime, byExtension);
        if (candidates.isEmpty()) {
            candidates = filter(formats, f -> f.getContentDetector().isPresent());
            candidates = filter(candidates, f -> runDetector(f, context));
            LOG.debug("No detection signals for {}, content detectors matched {}", name, candidates);
        } else if (candidates.size() > 1) {
            candidates = narrowByContent(candidates, context);
        }

        if (candidates.isEmpty()) {
            throw new FormatDetectionException(name, "Cannot detect the format of " + name
                    + ": no registered format matches its name, MIME type or content");
        }
        ConverterMetadata chosen = highestPriority(candidates);
        LOG.debug("Detected {} as {}", name, chosen.getFormatName());
        return chosen;
    }

    /**
     * Intersects the signals that produced candidates. When they disagree entirely the strongest
     * signal wins: magic bytes, then MIME type, then extension.
     */
    private List<ConverterMetadata> combine(Collection<ConverterMetadata> formats, List<ConverterMetadata> byMagic,
                                            List<ConverterMetadata> byMime, List<ConverterMetadata> byExtension) {
        List<List<ConverterMetadata>> signals = new ArrayList<>();
        for (List<ConverterMetadata> signal : List.of(byMagic, byMime, byExtension)) {
            if (!signal.isEmpty()) {
                signals.add(signal);
            }
        }
        if (signals.isEmpty()) {
            return List.of();
        }
        List<ConverterMetadata> intersection = filter(formats, f -> signals.stream().allMatch(s -> s.contains(f)));
        if (!intersection.isEmpty()) {
            return intersection;
        }
        LOG.debug("Detection signals disagree, using the strongest one: {}", signals.get(0));
        return signals.get(0);
    }

    /**
     * Keeps the candidates whose content detector accepts the input. If none does, only
     * the candidates without a detector remain, so a generic format (e.g. zip) is chosen
     * over a specific one whose detector rejected the content.
     */
    private List<ConverterMetadata> narrowByContent(List<ConverterMetadata> candidates, DetectionContext context) {
        List<ConverterMetadata> withDetector = filter(candidates, f -> f.getContentDetector().isPresent());
        if (withDetector.isEmpty()) {
            return candidates;
        }
        List<ConverterMetadata> matched = filter(withDetector, f -> runDetector(f, context));
        LOG.debug("Content detectors of {} matched {}", withDetector, matched);
        if (!matched.isEmpty()) {
            return matched;
        }
        return filter(candidates, f -> f.getContentDetector().isEmpty());
    }

    private static ConverterMetadata highestPriority(List<ConverterMetadata> candidates) {
        ConverterMetadata best = candidates.get(0);
        for (ConverterMetadata candidate : candidates) {
            if (candidate.getPriority() > best.getPriority()) {
                best = candidate;
            }
        }
        return best;
    }

    private boolean runDetector(ConverterMetadata format, DetectionContext context) {
        ContentDetector detector = format.getContentDetector().orElseThrow();
        try {
            return detector.matches(context);
        } catch (IOException e) {
            LOG.debug("Content detector of {} could not read the input: {}", format.getFormatName(), e.toString());
            return false;
        }
    }

    private byte[] readPrefix(DocumentInput input) {
        try {
            return input.readPrefix(prefixLimit);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + input.describe() + " for format detection", e);
        }
    }

    private static List<ConverterMetadata> filter(Collection<ConverterMetadata> formats, Predicate<ConverterMetadata> predicate) {
        return formats.stream().filter(predicate).collect(Collectors.toList());
    }
}
