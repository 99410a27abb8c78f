package org.neuralchilli.acms.service;

import java.util.Optional;

/**
 * Result of loading one graph document.
 */
public sealed interface LoadResult {

    boolean isSuccess();

    /**
     * Graph name on success, file name on failure
     */
    String name();

    Optional<String> error();

    record Success(String name, int taskCount) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String name, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String name, int taskCount) {
        return new Success(name, taskCount);
    }

    static LoadResult failure(String name, String error) {
        return new Failure(name, error);
    }

    static LoadResult failure(String name, Exception e) {
        return new Failure(name, e.getMessage());
    }
}
