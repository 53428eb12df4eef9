package io.github.drompincen.clawtrigger.runtime.scheduler.xxljob;

public class XxlJobAdminException extends RuntimeException {

    public XxlJobAdminException(String message) {
        super(message);
    }

    public XxlJobAdminException(String message, Throwable cause) {
        super(message, cause);
    }
}
