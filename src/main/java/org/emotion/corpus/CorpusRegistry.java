package org.emotion.corpus;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.emotion.error.UnknownCorpusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only mapping from corpus id to {@link CorpusMetadata}.
 *
 * Literal tables come from a JSON document (label maps, speaker lists, affect groups and
 * speaker group tables); the name rules come from {@link CorpusRules}. The registry is
 * built once and never changes, so it can be shared between threads.
 */
public final class CorpusRegistry {

    private static final Logger log = LoggerFactory.getLogger(CorpusRegistry.class);

    public static final String DEFAULT_RESOURCE = "corpora.json";

    private final Map<String, CorpusMetadata> byId;

    public CorpusRegistry(Map<String, CorpusMetadata> byId) {
        Objects.requireNonNull(byId, "byId must not be null");
        Map<String, CorpusMetadata> copy = new LinkedHashMap<>();
        byId.forEach((id, meta) -> copy.put(canonical(id), meta));
        this.byId = Collections.unmodifiableMap(copy);
    }

    /** Process-wide registry backed by the bundled corpus tables. */
    public static CorpusRegistry defaultRegistry() {
        return Holder.INSTANCE;
    }

    /**
     * Parses corpus tables from JSON. Every corpus in the document must have a speaker rule.
     */
    public static CorpusRegistry fromJson(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        Map<String, CorpusEntry> entries = new ObjectMapper()
                .readValue(in, new TypeReference<LinkedHashMap<String, CorpusEntry>>() { });

        Map<String, CorpusMetadata> byId = new LinkedHashMap<>();
        for (Map.Entry<String, CorpusEntry> e : entries.entrySet()) {
            String id = canonical(e.getKey());
            byId.put(id, e.getValue().toMetadata(id));
        }
        log.debug("Loaded {} corpus definitions", byId.size());
        return new CorpusRegistry(byId);
    }

    /**
     * @throws UnknownCorpusException if the corpus id is not registered
     */
    public CorpusMetadata resolve(String corpusId) {
        if (corpusId == null || corpusId.isBlank()) {
            throw new UnknownCorpusException(String.valueOf(corpusId));
        }
        CorpusMetadata meta = byId.get(canonical(corpusId));
        if (meta == null) {
            throw new UnknownCorpusException(corpusId);
        }
        return meta;
    }

    public boolean contains(String corpusId) {
        return corpusId != null && byId.containsKey(canonical(corpusId));
    }

    public Set<String> ids() {
        return byId.keySet();
    }

    private static String canonical(String id) {
        return id.strip().toLowerCase(Locale.ROOT);
    }

    private static final class Holder {
        private static final CorpusRegistry INSTANCE = load();

        private static CorpusRegistry load() {
            try (InputStream in = CorpusRegistry.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing corpus resource: " + DEFAULT_RESOURCE);
                }
                return fromJson(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
            }
        }
    }

    /** JSON shape of a single corpus. */
    record CorpusEntry(Map<String, String> labelMap,
                       EmotionGroups arousal,
                       EmotionGroups valence,
                       List<String> maleSpeakers,
                       List<String> femaleSpeakers,
                       List<String> speakers,
                       int[] speakerGroups) {

        CorpusMetadata toMetadata(String id) {
            NameRule speakerRule = CorpusRules.speakerRule(id).orElseThrow(() ->
                    new IllegalStateException("No speaker rule registered for corpus " + id)
            );
            return CorpusMetadata.builder(id)
                    .labelMap(labelMap == null ? Map.of() : labelMap)
                    .arousal(arousal)
                    .valence(valence)
                    .maleSpeakers(maleSpeakers)
                    .femaleSpeakers(femaleSpeakers)
                    .speakers(speakers)
                    .speakerGroups(speakerGroups)
                    .labelRule(CorpusRules.labelRule(id).orElse(null))
                    .speakerRule(speakerRule)
                    .build();
        }
    }
}
