package org.nowstart.grammar.service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.nowstart.grammar.data.exception.GrammarApiException;
import org.nowstart.grammar.data.property.GrammarProperties;
import org.nowstart.grammar.engine.core.InstrumentSummary;
import org.nowstart.grammar.engine.pipeline.InstrumentPipeline;
import org.nowstart.grammar.engine.pipeline.InstrumentPipelineFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Holds one pipeline per configured instrument and serialises access to each. Instruments never share a lock.
 */
@Service
public class InstrumentPipelineRegistry {

    private final Map<String, InstrumentPipeline> pipelines = new ConcurrentHashMap<>();

    public InstrumentPipelineRegistry(InstrumentPipelineFactory instrumentPipelineFactory, GrammarProperties properties) {
        for (String instrument : properties.instruments()) {
            String key = normalize(instrument);
            pipelines.computeIfAbsent(key, instrumentPipelineFactory::create);
        }
    }

    public <T> T execute(String instrument, Function<InstrumentPipeline, T> action) {
        InstrumentPipeline pipeline = require(instrument);
        synchronized (pipeline) {
            return action.apply(pipeline);
        }
    }

    public List<String> instruments() {
        return pipelines.keySet().stream().sorted().toList();
    }

    public List<InstrumentSummary> summaries() {
        return instruments().stream()
                .map(instrument -> execute(instrument, InstrumentPipeline::summary))
                .toList();
    }

    private InstrumentPipeline require(String instrument) {
        if (instrument == null || instrument.isBlank()) {
            throw new GrammarApiException(HttpStatus.BAD_REQUEST, "invalid_instrument", "instrument is required");
        }
        InstrumentPipeline pipeline = pipelines.get(normalize(instrument));
        if (pipeline == null) {
            throw new GrammarApiException(
                    HttpStatus.NOT_FOUND,
                    "unknown_instrument",
                    "No pipeline configured for instrument=" + instrument
            );
        }
        return pipeline;
    }

    private static String normalize(String instrument) {
        return instrument.trim().toUpperCase(Locale.ROOT);
    }
}
