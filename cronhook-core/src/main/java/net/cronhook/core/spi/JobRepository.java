package net.cronhook.core.spi;

import net.cronhook.core.model.JobDefinition;

import java.util.List;
import java.util.Optional;

public interface JobRepository {
    List<JobDefinition> loadActiveJobs() throws Exception;
    List<JobDefinition> findAll() throws Exception;
    Optional<JobDefinition> findById(String id) throws Exception;

    /** 저장된 행 반환 (createdAt 채워짐) */
    JobDefinition insert(JobDefinition job) throws Exception;
    void update(JobDefinition job) throws Exception;
    boolean delete(String id) throws Exception;

    long countAll() throws Exception;
    long countActive() throws Exception;
}
