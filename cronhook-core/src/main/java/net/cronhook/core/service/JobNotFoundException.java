package net.cronhook.core.service;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String id) { super("Job not found: " + id); }
}
