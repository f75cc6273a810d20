package io.minicron.core.job;

public record JobDraft(
    String id,
    String name,
    String cronExpression,
    String command,
    String description,
    Boolean enabled,
    Integer timeoutSeconds
) {

    public static JobDraft of(String name, String cronExpression, String command) {
        return new JobDraft(null, name, cronExpression, command, "", true, null);
    }

    public JobDraft withId(String newId) {
        return new JobDraft(newId, name, cronExpression, command, description, enabled, timeoutSeconds);
    }
}
