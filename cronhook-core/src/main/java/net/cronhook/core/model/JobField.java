package net.cronhook.core.model;

import java.util.EnumSet;
import java.util.Set;

/** Mutable fields of a job; an update reports which of them changed. */
public enum JobField {
    URL, SCHEDULE, BODY, SECRET, ACTIVE;

    public static Set<JobField> diff(JobDefinition before, JobDefinition after) {
        var changed = EnumSet.noneOf(JobField.class);
        if (!eq(before.url(), after.url())) changed.add(URL);
        if (!eq(before.schedule(), after.schedule())) changed.add(SCHEDULE);
        if (!eq(before.body(), after.body())) changed.add(BODY);
        if (!eq(before.secret(), after.secret())) changed.add(SECRET);
        if (before.active() != after.active()) changed.add(ACTIVE);
        return changed;
    }

    private static boolean eq(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
