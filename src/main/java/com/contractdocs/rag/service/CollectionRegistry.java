package com.contractdocs.rag.service;

import com.contractdocs.rag.config.RagProperties;
import com.contractdocs.rag.exception.InvalidConfigurationException;
import com.contractdocs.rag.exception.UnknownCollectionException;
import com.contractdocs.rag.model.CollectionRegistration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Logical collection names and the documents they were built from, in
 * registration order. Lookups never touch the store.
 */
@Slf4j
@Component
public class CollectionRegistry {

    private final Map<String, CollectionRegistration> registrations = new LinkedHashMap<>();

    @Autowired
    public CollectionRegistry(RagProperties properties) {
        this(properties.collections());
    }

    public CollectionRegistry(List<CollectionRegistration> initial) {
        initial.forEach(registration -> register(registration.name(), registration.sourceDocument()));
        log.info("Registered {} collections: {}", registrations.size(), registrations.keySet());
    }

    public synchronized void register(String name, String sourceDocument) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Collection name cannot be blank");
        }
        if (registrations.containsKey(name)) {
            throw new InvalidConfigurationException("Collection '" + name + "' is registered twice");
        }
        registrations.put(name, new CollectionRegistration(name, sourceDocument));
    }

    public synchronized List<CollectionRegistration> list() {
        return List.copyOf(registrations.values());
    }

    /**
     * @return the source document of the collection, empty when none was recorded
     * @throws UnknownCollectionException when the name is not registered
     */
    public synchronized Optional<String> resolve(String name) {
        CollectionRegistration registration = registrations.get(name);
        if (registration == null) {
            throw new UnknownCollectionException(name);
        }
        return Optional.ofNullable(registration.sourceDocument());
    }
}
