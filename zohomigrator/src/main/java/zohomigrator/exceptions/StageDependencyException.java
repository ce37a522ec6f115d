package zohomigrator.exceptions;

/**
 * Thrown when a stage is requested but one of the stages it depends on has
 * already failed in the current run.
 */
public class StageDependencyException extends MigrateException {

    public StageDependencyException(String stage, String failedDependency) {
        super("Cannot run " + stage + ": dependency " + failedDependency + " failed");
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
