package com.example.rittdoc.service.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh {@link ReferenceMapper} for every conversion job.
 */
@Component
public class ReferenceMapperFactory {

    private final ObjectMapper objectMapper;

    @Autowired
    public ReferenceMapperFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReferenceMapper newMapper() {
        return new ReferenceMapper(objectMapper);
    }
}
