package io.github.flameyossnowy.resources.api.exceptions;

public class RepositoryException extends RuntimeException {
    private final String repositoryName;

    public RepositoryException(String message, String repositoryName) {
        super(message);
        this.repositoryName = repositoryName;
    }

    public RepositoryException(String message, Throwable cause, String repositoryName) {
        super(message, cause);
        this.repositoryName = repositoryName;
    }

    public String getRepositoryName() {
        return repositoryName;
    }
}
