package com.genbatch.orchestrator.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.Sleeper;
import com.genbatch.orchestrator.config.BatchProperties;

import java.net.http.HttpClient;
import java.time.Clock;

/** Builds one {@link GenerationClient} per worker, sharing the transport. */
public class GenerationClientFactory {

    private final HttpClient               http;
    private final ObjectMapper             json;
    private final BatchProperties.Protocol settings;
    private final Clock                    clock;
    private final Sleeper                  sleeper;

    public GenerationClientFactory(HttpClient http, ObjectMapper json,
                                   BatchProperties.Protocol settings, Clock clock, Sleeper sleeper) {
        this.http     = http;
        this.json     = json;
        this.settings = settings;
        this.clock    = clock;
        this.sleeper  = sleeper;
    }

    public GenerationClient create(String baseUrl) {
        return new GenerationClient(baseUrl, http, json, settings, clock, sleeper);
    }
}
