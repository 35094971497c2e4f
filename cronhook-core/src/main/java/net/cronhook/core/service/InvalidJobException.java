package net.cronhook.core.service;

public class InvalidJobException extends IllegalArgumentException {
    public InvalidJobException(String message) { super(message); }
    public InvalidJobException(String message, Throwable cause) { super(message, cause); }
}
