package net.cronhook.core.service;

public class JobAlreadyExistsException extends IllegalStateException {
    public JobAlreadyExistsException(String id) { super("Job with this ID already exists: " + id); }
}
