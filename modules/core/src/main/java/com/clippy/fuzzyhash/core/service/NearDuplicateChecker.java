package com.clippy.fuzzyhash.core.service;

import com.clippy.fuzzyhash.util.Digest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds known digests within the configured distance of a candidate, avoiding storage of near-duplicates.
 * The known set is supplied by the caller; nothing is kept between calls.
 */
@ApplicationScoped
public class NearDuplicateChecker {

    private static final Logger log = Logger.getLogger(NearDuplicateChecker.class);

    private static final Comparator<Match> BY_DISTANCE =
            Comparator.comparingInt(Match::distance)
                    .thenComparing(Match::key, Comparator.nullsFirst(Comparator.naturalOrder()));

    @Inject
    FuzzyHashService fuzzyHashService;

    @ConfigProperty(name = "fuzzyhash.near-duplicate.max-distance", defaultValue = "40")
    int maxDistance;

    public record Match(String key, Digest digest, int distance) {}

    /**
     * Closest known digest within the maximum distance. Ties go to the smaller key, a null key first.
     */
    public Optional<Match> findNearest(Digest candidate, Map<String, Digest> known) {
        return findAll(candidate, known).stream().findFirst();
    }

    /**
     * All known digests within the maximum distance, closest first.
     */
    public List<Match> findAll(Digest candidate, Map<String, Digest> known) {
        Objects.requireNonNull(candidate, "candidate cannot be null");
        Objects.requireNonNull(known, "known digests cannot be null");

        List<Match> matches = new ArrayList<>();
        for (Map.Entry<String, Digest> entry : known.entrySet()) {
            int distance = fuzzyHashService.compare(candidate, entry.getValue());
            if (distance <= maxDistance) {
                matches.add(new Match(entry.getKey(), entry.getValue(), distance));
            }
        }
        matches.sort(BY_DISTANCE);
        return matches;
    }

    /**
     * Same as {@link #findNearest(Digest, Map)} for digests kept in text form.
     * Entries that do not parse are skipped.
     */
    public Optional<Match> findNearestHex(Digest candidate, Map<String, String> knownHex) {
        Objects.requireNonNull(knownHex, "known digests cannot be null");

        Map<String, Digest> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : knownHex.entrySet()) {
            try {
                parsed.put(entry.getKey(), Digest.fromHex(entry.getValue()));
            } catch (IllegalArgumentException e) {
                log.warnf("Skipping %s: unparseable digest '%s' (%s)",
                        entry.getKey(), entry.getValue(), e.getMessage());
            }
        }
        return findNearest(candidate, parsed);
    }
}
