package net.cronhook.core.model;

import java.util.Optional;

/**
 * Partial update of a job. Unset fields keep their stored value; body and secret can also be
 * cleared explicitly.
 */
public final class JobPatch {
    private String url;
    private String schedule;
    private Boolean active;
    private Optional<String> body;      // null = 변경 없음
    private Optional<String> secret;    // null = 변경 없음

    public static JobPatch empty() { return new JobPatch(); }

    public JobPatch url(String url) { this.url = url; return this; }
    public JobPatch schedule(String schedule) { this.schedule = schedule; return this; }
    public JobPatch active(boolean active) { this.active = active; return this; }
    public JobPatch body(String body) { this.body = Optional.ofNullable(body); return this; }
    public JobPatch clearBody() { this.body = Optional.empty(); return this; }
    public JobPatch secret(String secret) { this.secret = Optional.ofNullable(secret); return this; }
    public JobPatch clearSecret() { this.secret = Optional.empty(); return this; }

    public String url() { return url; }
    public String schedule() { return schedule; }

    public boolean isEmpty() {
        return url == null && schedule == null && active == null && body == null && secret == null;
    }

    public JobDefinition applyTo(JobDefinition job) {
        return new JobDefinition(
                job.id(),
                url != null ? url : job.url(),
                schedule != null ? schedule : job.schedule(),
                body != null ? body.orElse(null) : job.body(),
                secret != null ? secret.orElse(null) : job.secret(),
                active != null ? active : job.active(),
                job.createdAt(),
                job.createdBy()
        );
    }
}
