package app.unilex.srs.review.algorithm;

import app.unilex.srs.config.SrsProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class AlgorithmRegistry {

    private static final Logger log = LoggerFactory.getLogger(AlgorithmRegistry.class);

    private final Map<String, SrsAlgorithm> algorithms;
    private final String defaultAlgorithmId;

    public AlgorithmRegistry(List<SrsAlgorithm> list, SrsProps props) {
        Map<String, SrsAlgorithm> map = new HashMap<>();
        for (var a : list) map.put(a.id(), a);
        this.algorithms = Map.copyOf(map);
        this.defaultAlgorithmId = props.schedule().defaultAlgorithm();
        if (!algorithms.containsKey(defaultAlgorithmId)) {
            throw new IllegalStateException("Default algorithm is not registered: " + defaultAlgorithmId);
        }
    }

    public SrsAlgorithm require(String id) {
        var a = algorithms.get(id);
        if (a == null) throw new IllegalArgumentException("Unsupported algorithm: " + id);
        return a;
    }

    public SrsAlgorithm resolveOrDefault(String id) {
        if (id == null) {
            return algorithms.get(defaultAlgorithmId);
        }
        var a = algorithms.get(id);
        if (a == null) {
            log.warn("Unknown algorithm '{}' in stored schedule, falling back to '{}'", id, defaultAlgorithmId);
            return algorithms.get(defaultAlgorithmId);
        }
        return a;
    }

    public String defaultAlgorithmId() {
        return defaultAlgorithmId;
    }
}
