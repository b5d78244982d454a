package com.intervista.core.analyzer;

import com.intervista.core.model.AvailableInputs;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemorySubmissionStore implements SubmissionStore {

    private final ConcurrentHashMap<String, AvailableInputs> submissions = new ConcurrentHashMap<>();

    @Override
    public void put(String key, AvailableInputs inputs) {
        submissions.put(key, inputs);
    }

    @Override
    public Optional<AvailableInputs> get(String key) {
        return Optional.ofNullable(submissions.get(key));
    }

    @Override
    public void remove(String key) {
        submissions.remove(key);
    }
}
