package org.neuralchilli.chadoxml.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.domain.Analysis;
import org.neuralchilli.chadoxml.domain.AnalysisFeature;
import org.neuralchilli.chadoxml.domain.AppliedProtocol;
import org.neuralchilli.chadoxml.domain.Attribute;
import org.neuralchilli.chadoxml.domain.CV;
import org.neuralchilli.chadoxml.domain.CVTerm;
import org.neuralchilli.chadoxml.domain.DB;
import org.neuralchilli.chadoxml.domain.DBXref;
import org.neuralchilli.chadoxml.domain.Datum;
import org.neuralchilli.chadoxml.domain.Entity;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.domain.ExperimentProp;
import org.neuralchilli.chadoxml.domain.Feature;
import org.neuralchilli.chadoxml.domain.FeatureLoc;
import org.neuralchilli.chadoxml.domain.FeatureRelationship;
import org.neuralchilli.chadoxml.domain.Organism;
import org.neuralchilli.chadoxml.domain.Protocol;
import org.neuralchilli.chadoxml.service.ParsedSubmission;
import org.neuralchilli.chadoxml.service.SubmissionLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads a YAML experiment description into the object cache.
 * <p>
 * Entities are registered as they are read; cross references (data to features, steps to
 * protocols and data) go through {@link ObjectCache#getOrCreate}, so the order of sections
 * does not matter. A reference to something the description never defines stays a
 * placeholder for the validators to report.
 * <p>
 * Term references are written either as {@code {cv: SO, term: gene}} or as {@code "SO:gene"}.
 */
@ApplicationScoped
public class ExperimentYamlParser {

    private static final Logger log = LoggerFactory.getLogger(ExperimentYamlParser.class);

    private final Yaml yaml = new Yaml();

    @Inject
    ObjectCache cache;

    public ExperimentYamlParser() {
    }

    ExperimentYamlParser(ObjectCache cache) {
        this.cache = cache;
    }

    /**
     * Parse an experiment description file.
     */
    public ParsedSubmission parse(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new SubmissionLoadException("Experiment description not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException e) {
            throw new SubmissionLoadException("Cannot read " + path, e);
        }
    }

    /**
     * Parse an experiment description from a YAML string.
     */
    public ParsedSubmission parse(String yamlContent) {
        return parseDocument(load(() -> yaml.load(yamlContent)));
    }

    /**
     * Parse an experiment description from an InputStream.
     */
    public ParsedSubmission parse(InputStream inputStream) {
        return parseDocument(load(() -> yaml.load(inputStream)));
    }

    private interface Loader {
        Object load();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> load(Loader loader) {
        Object document;
        try {
            document = loader.load();
        } catch (YAMLException e) {
            throw new SubmissionLoadException("Malformed experiment description: " + e.getMessage(), e);
        }
        if (!(document instanceof Map)) {
            throw new SubmissionLoadException("Experiment description must be a YAML mapping");
        }
        return (Map<String, Object>) document;
    }

    private ParsedSubmission parseDocument(Map<String, Object> data) {
        try {
            List<CachedHandle<DB>> termSources = new ArrayList<>();
            for (Map<String, Object> source : getMapList(data, "term_sources")) {
                termSources.add(parseTermSource(source));
            }

            getMapList(data, "organisms").forEach(this::parseOrganism);
            getMapList(data, "analyses").forEach(this::parseAnalysis);

            List<CachedHandle<Protocol>> protocols = new ArrayList<>();
            for (Map<String, Object> protocol : getMapList(data, "protocols")) {
                protocols.add(parseProtocol(protocol));
            }

            getMapList(data, "features").forEach(this::parseFeature);
            getMapList(data, "data").forEach(this::parseDatum);

            List<CachedHandle<AppliedProtocol>> steps = new ArrayList<>();
            for (Map<String, Object> step : getMapList(data, "steps")) {
                steps.add(parseStep(step));
            }

            CachedHandle<Experiment> experiment = parseExperiment(getMap(data, "experiment", true), steps);

            log.info("Read experiment {} ({} protocols, {} steps, {} term sources)",
                    experiment.id(), protocols.size(), steps.size(), termSources.size());
            return new ParsedSubmission(experiment, protocols, termSources);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new SubmissionLoadException("Invalid experiment description: " + e.getMessage(), e);
        }
    }

    private CachedHandle<Experiment> parseExperiment(Map<String, Object> data,
                                                     List<CachedHandle<AppliedProtocol>> steps) {
        String id = getString(data, "id", false);
        if (id == null) {
            id = cache.newIdentifier(Experiment.class);
        }

        List<CachedHandle<ExperimentProp>> properties = new ArrayList<>();
        int rank = 0;
        for (Map<String, Object> prop : getMapList(data, "properties")) {
            properties.add(cache.put(new ExperimentProp(
                    cache.newIdentifier(ExperimentProp.class),
                    getString(prop, "name", true),
                    getString(prop, "value", false),
                    getInteger(prop, "rank", rank++),
                    term(prop.get("type")),
                    dbxref(prop.get("dbxref"))
            )));
        }

        return cache.put(new Experiment(
                id,
                getString(data, "uniquename", true),
                getString(data, "description", false),
                properties,
                steps
        ));
    }

    private CachedHandle<DB> parseTermSource(Map<String, Object> data) {
        String name = getString(data, "name", true);
        requireUndefined(DB.class, name);
        return cache.put(new DB(
                name,
                name,
                getString(data, "url", false),
                getString(data, "description", false)
        ));
    }

    private void parseOrganism(Map<String, Object> data) {
        String id = getString(data, "id", true);
        requireUndefined(Organism.class, id);
        cache.put(new Organism(
                id,
                getString(data, "genus", true),
                getString(data, "species", true)
        ));
    }

    private void parseAnalysis(Map<String, Object> data) {
        String id = getString(data, "id", true);
        requireUndefined(Analysis.class, id);
        cache.put(new Analysis(
                id,
                getString(data, "name", false),
                getString(data, "program", true),
                getString(data, "programversion", true),
                getString(data, "sourcename", false),
                getString(data, "description", false)
        ));
    }

    private CachedHandle<Protocol> parseProtocol(Map<String, Object> data) {
        String name = getString(data, "name", true);
        requireUndefined(Protocol.class, name);
        return cache.put(new Protocol(
                name,
                name,
                getString(data, "description", false),
                getInteger(data, "version", null),
                dbxref(data.get("dbxref")),
                parseAttributes(data)
        ));
    }

    private List<CachedHandle<Attribute>> parseAttributes(Map<String, Object> owner) {
        List<CachedHandle<Attribute>> attributes = new ArrayList<>();
        int rank = 0;
        for (Map<String, Object> attribute : getMapList(owner, "attributes")) {
            attributes.add(cache.put(new Attribute(
                    cache.newIdentifier(Attribute.class),
                    getString(attribute, "name", true),
                    getString(attribute, "heading", false),
                    getString(attribute, "value", false),
                    getInteger(attribute, "rank", rank++),
                    term(attribute.get("type")),
                    dbxref(attribute.get("dbxref"))
            )));
        }
        return attributes;
    }

    private void parseDatum(Map<String, Object> data) {
        String id = getString(data, "id", true);
        requireUndefined(Datum.class, id);
        cache.put(new Datum(
                id,
                getString(data, "name", false),
                getString(data, "heading", true),
                getString(data, "value", false),
                term(data.get("type")),
                dbxref(data.get("dbxref")),
                parseAttributes(data),
                getStringList(data, "features").stream()
                        .map(featureId -> cache.getOrCreate(Feature.class, featureId))
                        .collect(Collectors.toList())
        ));
    }

    private void parseFeature(Map<String, Object> data) {
        String id = getString(data, "id", true);
        requireUndefined(Feature.class, id);
        CachedHandle<Feature> self = cache.getOrCreate(Feature.class, id);

        List<FeatureLoc> locations = new ArrayList<>();
        int rank = 0;
        for (Map<String, Object> location : getMapList(data, "locations")) {
            locations.add(new FeatureLoc(
                    cache.getOrCreate(Feature.class, getString(location, "srcfeature", true)),
                    getInteger(location, "fmin", null),
                    getInteger(location, "fmax", null),
                    getInteger(location, "strand", null),
                    rank++
            ));
        }

        List<FeatureRelationship> relationships = new ArrayList<>();
        rank = 0;
        for (Map<String, Object> relationship : getMapList(data, "relationships")) {
            relationships.add(new FeatureRelationship(
                    term(relationship.get("type")),
                    cache.getOrCreate(Feature.class, getString(relationship, "object", true)),
                    rank++
            ));
        }

        List<CachedHandle<AnalysisFeature>> analysisFeatures = new ArrayList<>();
        for (Map<String, Object> result : getMapList(data, "analyses")) {
            analysisFeatures.add(cache.put(new AnalysisFeature(
                    cache.newIdentifier(AnalysisFeature.class),
                    getDouble(result, "rawscore"),
                    getDouble(result, "normscore"),
                    getDouble(result, "significance"),
                    getDouble(result, "identity"),
                    self,
                    cache.getOrCreate(Analysis.class, getString(result, "analysis", true))
            )));
        }

        String organism = getString(data, "organism", false);
        cache.put(new Feature(
                id,
                getString(data, "name", false),
                getString(data, "uniquename", false) != null ? getString(data, "uniquename", false) : id,
                getString(data, "residues", false),
                getInteger(data, "seqlen", null),
                term(data.get("type")),
                organism == null ? null : cache.getOrCreate(Organism.class, organism),
                dbxref(data.get("dbxref")),
                locations,
                relationships,
                analysisFeatures
        ));
    }

    private CachedHandle<AppliedProtocol> parseStep(Map<String, Object> data) {
        String id = getString(data, "id", false);
        if (id == null) {
            id = cache.newIdentifier(AppliedProtocol.class);
        }
        requireUndefined(AppliedProtocol.class, id);
        return cache.put(new AppliedProtocol(
                id,
                cache.getOrCreate(Protocol.class, getString(data, "protocol", true)),
                datumHandles(getStringList(data, "inputs")),
                datumHandles(getStringList(data, "outputs"))
        ));
    }

    private List<CachedHandle<Datum>> datumHandles(List<String> ids) {
        return ids.stream()
                .map(id -> cache.getOrCreate(Datum.class, id))
                .collect(Collectors.toList());
    }

    /**
     * A definition may only fill a placeholder, never replace an entity defined earlier.
     */
    private <T extends Entity> void requireUndefined(Class<T> type, String id) {
        CachedHandle<T> existing = cache.find(type, id);
        if (existing != null && !existing.isPlaceholder()) {
            throw new SubmissionLoadException("Duplicate " + existing.type() + " id: " + id);
        }
    }

    /**
     * Handle for a vocabulary term, registering the term and its vocabulary the first time
     * they are mentioned.
     */
    @SuppressWarnings("unchecked")
    private CachedHandle<CVTerm> term(Object value) {
        if (value == null) {
            return null;
        }

        String vocabulary;
        String name;
        if (value instanceof Map) {
            Map<String, Object> map = (Map<String, Object>) value;
            vocabulary = getString(map, "cv", true);
            name = getString(map, "term", true);
        } else {
            String text = value.toString();
            int colon = text.indexOf(':');
            if (colon <= 0 || colon == text.length() - 1) {
                throw new IllegalArgumentException("Term reference must look like 'cv:term': " + text);
            }
            vocabulary = text.substring(0, colon);
            name = text.substring(colon + 1);
        }

        CachedHandle<CV> cv = cache.getOrCreate(CV.class, vocabulary);
        if (cv.isPlaceholder()) {
            cache.put(new CV(vocabulary, vocabulary, null));
        }

        CachedHandle<CVTerm> term = cache.getOrCreate(CVTerm.class, vocabulary + ":" + name);
        if (term.isPlaceholder()) {
            cache.put(new CVTerm(term.id(), name, null, false, cv, null));
        }
        return term;
    }

    @SuppressWarnings("unchecked")
    private CachedHandle<DBXref> dbxref(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("dbxref must be a mapping with db and accession");
        }

        Map<String, Object> map = (Map<String, Object>) value;
        String db = getString(map, "db", true);
        String accession = getString(map, "accession", true);

        CachedHandle<DBXref> handle = cache.getOrCreate(DBXref.class, db + ":" + accession);
        if (handle.isPlaceholder()) {
            cache.put(new DBXref(handle.id(), accession, getString(map, "version", false),
                    cache.getOrCreate(DB.class, db)));
        }
        return handle;
    }

    // Helper methods

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private Integer getInteger(Map<String, Object> map, String key, Integer defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private Double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    private List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        throw new IllegalArgumentException("Field " + key + " must be a list");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMap(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required section: " + key);
            }
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Section " + key + " must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Section " + key + " must be a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Entries of " + key + " must be mappings");
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }
}
