package net.cronhook.core.model;

import java.time.Instant;

public record JobDefinition(
        String id,
        String url,
        String schedule,
        String body,        // 그대로 전송, null = 본문 없음
        String secret,      // Bearer 토큰, null = Authorization 헤더 없음
        boolean active,
        Instant createdAt,
        String createdBy
) {
    public static final String DEFAULT_CREATOR = "cronhook";

    public static JobDefinition ofNew(String id, String url, String schedule, String body, String secret, boolean active) {
        return new JobDefinition(id, url, schedule, body, secret, active, null, DEFAULT_CREATOR);
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }

    public boolean hasSecret() {
        return secret != null && !secret.isEmpty();
    }

    /** secret은 출력하지 않음 */
    @Override
    public String toString() {
        return "JobDefinition{" +
                "id='" + id + '\'' +
                ", url='" + url + '\'' +
                ", schedule='" + schedule + '\'' +
                ", hasBody=" + hasBody() +
                ", hasSecret=" + hasSecret() +
                ", active=" + active +
                ", createdAt=" + createdAt +
                ", createdBy='" + createdBy + '\'' +
                '}';
    }
}
