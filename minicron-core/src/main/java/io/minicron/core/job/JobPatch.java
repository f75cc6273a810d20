package io.minicron.core.job;

public record JobPatch(
    String name,
    String cronExpression,
    String command,
    String description,
    Boolean enabled,
    Integer timeoutSeconds
) {

    public static JobPatch enabled(boolean enabled) {
        return new JobPatch(null, null, null, null, enabled, null);
    }

    public static JobPatch expression(String cronExpression) {
        return new JobPatch(null, cronExpression, null, null, null, null);
    }

    public boolean isEmpty() {
        return name == null
            && cronExpression == null
            && command == null
            && description == null
            && enabled == null
            && timeoutSeconds == null;
    }
}
