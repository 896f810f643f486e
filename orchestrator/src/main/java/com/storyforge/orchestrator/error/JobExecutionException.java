package com.storyforge.orchestrator.error;

/**
 * Thrown inside a worker when a stage job or workflow node fails.
 *
 * Never surfaces to the HTTP caller that dispatched the job. The category
 * decides whether the completion handler resubmits automatically or leaves
 * the stage failed for an explicit retry.
 */
public class JobExecutionException extends RuntimeException {

    public enum Category {
        TIMEOUT(true),
        SOFT_TIMEOUT(true),
        NETWORK(true),
        VALIDATION(false),
        MISSING_DATA(false),
        INTERNAL(false);

        private final boolean transientFailure;

        Category(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        public boolean isTransient() { return transientFailure; }
    }

    private final Category category;

    public JobExecutionException(Category category, String message) {
        super(message);
        this.category = category;
    }

    public JobExecutionException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public Category getCategory()  { return category; }
    public boolean  isTransient()  { return category.isTransient(); }
}
