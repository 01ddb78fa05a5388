package com.eainde.diagnosis.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Ordered static treatment protocols; the first protocol whose keywords appear in
 * the diagnosis wins. The last entry must be a catch-all so selection never fails.
 */
@Log4j2
public class TreatmentProtocolTable {

    public static final String DEFAULT_RESOURCE = "treatment-protocols.json";

    private final List<TreatmentProtocol> protocols;

    public TreatmentProtocolTable(List<TreatmentProtocol> protocols) {
        if (protocols == null || protocols.isEmpty()) {
            throw new IllegalArgumentException("Protocol table is empty");
        }
        if (!protocols.get(protocols.size() - 1).isCatchAll()) {
            throw new IllegalArgumentException("Last protocol must have no keywords so every diagnosis matches");
        }
        this.protocols = List.copyOf(protocols);
    }

    public static TreatmentProtocolTable fromClasspath(ObjectMapper objectMapper, String resource) {
        try (InputStream in = TreatmentProtocolTable.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Treatment protocol resource not found: " + resource);
            }
            List<TreatmentProtocol> protocols = objectMapper.readValue(in, new TypeReference<>() {});
            log.info("Loaded {} treatment protocols from {}", protocols.size(), resource);
            return new TreatmentProtocolTable(protocols);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read treatment protocols from " + resource, e);
        }
    }

    public TreatmentProtocol select(String diagnosis) {
        for (TreatmentProtocol protocol : protocols) {
            if (protocol.matches(diagnosis)) {
                return protocol;
            }
        }
        // unreachable: the constructor guarantees a catch-all
        return protocols.get(protocols.size() - 1);
    }

    public List<TreatmentProtocol> protocols() {
        return protocols;
    }
}
