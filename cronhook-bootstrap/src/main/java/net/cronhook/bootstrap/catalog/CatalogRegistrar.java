package net.cronhook.bootstrap.catalog;

import net.cronhook.bootstrap.props.CronhookProperties;
import net.cronhook.core.model.JobDefinition;
import net.cronhook.core.model.JobPatch;
import net.cronhook.core.service.JobManagementService;
import net.cronhook.core.service.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code cronhook.catalog.jobs} 선언을 DB에 반영.
 * 없으면 생성, 있으면 선언 기준으로 갱신 (body/secret 통째로 교체).
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobManagementService jobs;

    public CatalogRegistrar(JobManagementService jobs) {
        this.jobs = jobs;
    }

    public void register(CronhookProperties.Catalog catalog) throws Exception {
        for (var def : catalog.getJobs()) {
            register(def);
        }
    }

    private void register(CronhookProperties.JobDef def) throws Exception {
        if (def.getId() == null || def.getUrl() == null || def.getSchedule() == null) {
            throw new IllegalArgumentException("catalog job id, url and schedule are required: " + def);
        }

        JobDefinition existing;
        try {
            existing = jobs.get(def.getId());
        } catch (JobNotFoundException e) {
            jobs.create(JobDefinition.ofNew(def.getId(), def.getUrl(), def.getSchedule(),
                    def.getBody(), def.getSecret(), def.isActive()));
            log.info("Catalog registered: job='{}' created", def.getId());
            return;
        }

        var patch = JobPatch.empty()
                .url(def.getUrl())
                .schedule(def.getSchedule())
                .body(def.getBody())
                .secret(def.getSecret())
                .active(def.isActive());
        var updated = jobs.update(def.getId(), patch);
        log.info("Catalog registered: job='{}' {}", def.getId(), updated.equals(existing) ? "unchanged" : "updated");
    }
}
