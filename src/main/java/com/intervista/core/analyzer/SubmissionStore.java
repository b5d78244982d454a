package com.intervista.core.analyzer;

import com.intervista.core.model.AvailableInputs;

import java.util.Optional;

/**
 * Where submissions live while their session runs. Tasks refer to a submission by key
 * ({@code Task.inputRef}).
 */
public interface SubmissionStore {

    void put(String key, AvailableInputs inputs);

    Optional<AvailableInputs> get(String key);

    void remove(String key);
}
